package com.consent.reconciliation.bulk;

import com.consent.reconciliation.core.model.DataQualityWarning;

import java.util.List;

/**
 * Result of importing one input table.
 *
 * @param totalRecords number of data rows in the input
 * @param records      the typed records that were imported
 * @param warnings     values treated as absent and rows that were skipped
 * @param <T>          the record type
 */
public record ImportResult<T>(long totalRecords, List<T> records, List<DataQualityWarning> warnings) {

    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static <T> ImportResult<T> empty() {
        return new ImportResult<>(0, List.of(), List.of());
    }

    public long recordCount() {
        return records.size();
    }

    public long warningCount() {
        return warnings.size();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", records=" + records.size() +
                ", warnings=" + warnings.size() + '}';
    }
}
