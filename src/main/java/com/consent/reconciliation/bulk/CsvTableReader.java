package com.consent.reconciliation.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV table reader.
 *
 * <p>Expected format:</p>
 * <pre>
 * mnpaid,icdat,mnp_rando_gr,mnp_rando_v6_gr
 * 1001,2020-06-01,"Arm A",
 * 1002,01.07.2020,"Arm B","Arm B, extension"
 * </pre>
 *
 * <p>The first line is the header row. A field is quoted only when its first character
 * is a double quote; quotes inside quoted fields are doubled and quoted fields may span
 * lines. A quote anywhere else in a field is kept as a literal character, so
 * {@code Arm 5" dose} reads as written. The delimiter is detected from
 * the header: semicolon when it contains more semicolons than commas (spreadsheet
 * exports with a German locale), comma otherwise. Blank lines are skipped. A quoted field
 * still open at the end of the input fails the read rather than swallowing later rows.</p>
 */
public class CsvTableReader implements TableReader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);
    private static final char BOM = '\uFEFF';

    private final Character fixedDelimiter;

    /**
     * Creates a reader that detects the delimiter from the header row.
     */
    public CsvTableReader() {
        this.fixedDelimiter = null;
    }

    public CsvTableReader(char delimiter) {
        this.fixedDelimiter = delimiter;
    }

    @Override
    public RawTable read(Reader reader, String source) {
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                log.info("table.read source={} format=csv rows=0", source);
                return RawTable.empty(source);
            }
            if (!header.isEmpty() && header.charAt(0) == BOM) {
                header = header.substring(1);
            }
            char delimiter = fixedDelimiter != null ? fixedDelimiter : detectDelimiter(header);
            List<String> headers = new ArrayList<>();
            for (String h : splitLine(header, delimiter)) {
                headers.add(h.trim());
            }

            List<RawTable.Row> rows = new ArrayList<>();
            RecordSplitter splitter = new RecordSplitter(delimiter);
            String line;
            long lineNumber = 1;
            long startLine = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (!splitter.inQuotedField()) {
                    if (line.isBlank()) {
                        continue;
                    }
                    startLine = lineNumber;
                }
                if (splitter.feed(line)) {
                    rows.add(new RawTable.Row(startLine, splitter.finish()));
                }
            }
            if (splitter.inQuotedField()) {
                log.error("table.read.failed source={} error=unterminated quote line={}", source, startLine);
                throw new TableReadException("Unterminated quoted field in " + source
                        + " starting at line " + startLine);
            }

            log.info("table.read source={} format=csv columns={} rows={}", source, headers.size(), rows.size());
            return new RawTable(source, headers, rows);
        } catch (IOException e) {
            log.error("table.read.failed source={} error={}", source, e.getMessage());
            throw new TableReadException("IO error reading " + source + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static char detectDelimiter(String header) {
        int commas = 0;
        int semicolons = 0;
        boolean quoted = false;
        for (int i = 0; i < header.length(); i++) {
            char c = header.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == ',') {
                commas++;
            } else if (!quoted && c == ';') {
                semicolons++;
            }
        }
        return semicolons > commas ? ';' : ',';
    }

    /**
     * Splits a single-line CSV record into fields, handling quoted values.
     */
    static List<String> splitLine(String line, char delimiter) {
        RecordSplitter splitter = new RecordSplitter(delimiter);
        splitter.feed(line);
        return splitter.finish();
    }

    /**
     * Splits records fed one physical line at a time. Holds the only quote state of the
     * reader, so joining continuation lines and splitting fields cannot disagree.
     */
    static final class RecordSplitter {
        private final char delimiter;
        private final List<String> fields = new ArrayList<>();
        private final StringBuilder field = new StringBuilder();
        private boolean quoted;
        private boolean fieldStart = true;

        RecordSplitter(char delimiter) {
            this.delimiter = delimiter;
        }

        /**
         * Consumes one physical line.
         *
         * @return true when the record is complete, false when a quoted field continues
         *         on the next line
         */
        boolean feed(String line) {
            if (quoted) {
                field.append('\n');
            }
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (quoted) {
                    if (c == '"') {
                        if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                            field.append('"');
                            i++;
                        } else {
                            quoted = false;
                        }
                    } else {
                        field.append(c);
                    }
                    fieldStart = false;
                } else if (c == delimiter) {
                    fields.add(field.toString());
                    field.setLength(0);
                    fieldStart = true;
                } else if (c == '"' && fieldStart) {
                    quoted = true;
                    fieldStart = false;
                } else {
                    field.append(c);
                    fieldStart = false;
                }
                i++;
            }
            return !quoted;
        }

        boolean inQuotedField() {
            return quoted;
        }

        /**
         * Returns the fields of the current record and resets for the next one.
         */
        List<String> finish() {
            fields.add(field.toString());
            List<String> record = new ArrayList<>(fields);
            fields.clear();
            field.setLength(0);
            quoted = false;
            fieldStart = true;
            return record;
        }
    }
}
