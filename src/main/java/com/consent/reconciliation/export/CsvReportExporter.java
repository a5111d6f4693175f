package com.consent.reconciliation.export;

import com.consent.reconciliation.report.ReportTable;
import com.consent.reconciliation.report.ReportTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * CSV report exporter.
 *
 * <p>Output format (merged cells are left empty):</p>
 * <pre>
 * Patient-ID,Version of Informed Consent Form,Date of Consent,Comment
 * 1001,V1,2020-06-01,"A / B
 * EOS (01.12.2020)"
 * ,V2,n.a.,
 * </pre>
 */
public class CsvReportExporter implements ReportExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvReportExporter.class);

    private final char delimiter;

    public CsvReportExporter() {
        this(',');
    }

    public CsvReportExporter(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public ExportResult export(ReportTable table, Writer writer) {
        long rows = 0;
        try {
            writeLine(writer, ReportTable.HEADERS);
            for (ReportTableRow row : table.rows()) {
                writeLine(writer, List.of(row.participantCell(), row.version(), row.status(), row.commentCell()));
                rows++;
            }
            writer.flush();
        } catch (IOException e) {
            log.error("export.failed format=csv rows={} error={}", rows, e.getMessage());
            throw new UncheckedIOException("CSV export failed after " + rows + " rows", e);
        }

        ExportResult result = new ExportResult(rows, table.spans().size());
        log.info("export.completed format=csv result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private void writeLine(Writer writer, List<String> values) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                line.append(delimiter);
            }
            line.append(csvEscape(values.get(i)));
        }
        line.append('\n');
        writer.write(line.toString());
    }

    private String csvEscape(String value) {
        if (value == null) return "";
        if (value.indexOf(delimiter) >= 0 || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
