package com.consent.reconciliation.bulk;

import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.rules.CanonicalField;
import com.consent.reconciliation.rules.ColumnMapping;
import com.consent.reconciliation.rules.ColumnNormalizer;
import com.consent.reconciliation.rules.TableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Shared import loop: resolves the headers, checks the required columns, converts
 * row by row and reports progress. Subclasses only convert a single row.
 *
 * @param <T> the record type
 */
public abstract class AbstractTableImporter<T> implements TableImporter<T> {
    private static final Logger log = LoggerFactory.getLogger(AbstractTableImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ColumnNormalizer normalizer;

    protected AbstractTableImporter(ColumnNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    @Override
    public ImportResult<T> importRecords(RawTable table, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String label = getTableKind().label();
        List<DataQualityWarning> warnings = new ArrayList<>();

        ColumnMapping mapping = normalizer.map(getTableKind(), table.headers());
        if (!canImport(mapping, warnings)) {
            ImportResult<T> result = new ImportResult<>(table.rows().size(), List.of(), warnings);
            log.info("import.skipped table={} source={} result={}", label, table.source(), result);
            return result;
        }

        List<T> records = new ArrayList<>();
        long processed = 0;
        for (RawTable.Row row : table.rows()) {
            processed++;
            Cells cells = new Cells(label, table.headers(), row, mapping, warnings);
            T record = convert(cells);
            if (record != null) {
                records.add(record);
            }
            if (processed % PROGRESS_INTERVAL == 0) {
                cb.onProgress(processed, table.rows().size(), "Imported " + processed + " " + label + " rows");
            }
        }

        records = complete(records, warnings);
        ImportResult<T> result = new ImportResult<>(table.rows().size(), records, warnings);
        cb.onProgress(processed, table.rows().size(), "Import completed");
        log.info("import.completed table={} source={} result={}", label, table.source(), result);
        return result;
    }

    /**
     * Decides whether the table can be imported with the resolved columns.
     * The default requires every required field of the table and reports the missing ones.
     */
    protected boolean canImport(ColumnMapping mapping, List<DataQualityWarning> warnings) {
        List<CanonicalField> missing = mapping.missingRequired();
        if (missing.isEmpty()) {
            return true;
        }
        String message = "Missing required column(s) " + missing + "; table ignored";
        warnings.add(new DataQualityWarning(getTableKind().label(), 0, "", "", message));
        log.warn("import.columns.missing table={} missing={} unmapped={}",
                getTableKind().label(), missing, mapping.unmappedHeaders());
        return false;
    }

    /**
     * Converts one row, or returns null to skip it (after adding a warning).
     */
    protected abstract T convert(Cells cells);

    /**
     * Post-processes the converted records, e.g. to collapse duplicates.
     */
    protected List<T> complete(List<T> records, List<DataQualityWarning> warnings) {
        return records;
    }

    /**
     * Typed access to the cells of one row, recording data-quality warnings.
     */
    protected static final class Cells {
        private final String table;
        private final List<String> headers;
        private final RawTable.Row row;
        private final ColumnMapping mapping;
        private final List<DataQualityWarning> warnings;

        Cells(String table, List<String> headers, RawTable.Row row, ColumnMapping mapping,
              List<DataQualityWarning> warnings) {
            this.table = table;
            this.headers = headers;
            this.row = row;
            this.mapping = mapping;
            this.warnings = warnings;
        }

        public long lineNumber() {
            return row.lineNumber();
        }

        /**
         * Returns the trimmed cell value, or null when the column is absent or the cell blank.
         */
        public String text(CanonicalField field) {
            OptionalInt index = mapping.indexOf(field);
            if (index.isEmpty()) {
                return null;
            }
            String value = row.value(index.getAsInt()).trim();
            return value.isEmpty() ? null : value;
        }

        /**
         * Returns the parsed date, or null when the cell is blank or unparseable.
         * An unparseable value adds a warning.
         */
        public LocalDate date(CanonicalField field) {
            String value = text(field);
            if (value == null) {
                return null;
            }
            Optional<LocalDate> date = DateValueParser.parse(value);
            if (date.isEmpty()) {
                warn(field, value, "Unparseable date treated as absent");
                return null;
            }
            return date.get();
        }

        public void warn(CanonicalField field, String value, String message) {
            String column = field != null ? header(field) : "";
            warnings.add(new DataQualityWarning(table, row.lineNumber(), column, value, message));
            log.warn("import.value.degraded table={} line={} column='{}' value='{}' reason={}",
                    table, row.lineNumber(), column, value, message);
        }

        private String header(CanonicalField field) {
            OptionalInt index = mapping.indexOf(field);
            return index.isPresent() ? headers.get(index.getAsInt()) : field.name();
        }
    }
}
