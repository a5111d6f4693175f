package com.consent.reconciliation.export;

/**
 * Result of a report export.
 *
 * @param rowsWritten  number of table rows written, header excluded
 * @param spansWritten number of participant blocks written
 */
public record ExportResult(long rowsWritten, long spansWritten) {
    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + ", spans=" + spansWritten + '}';
    }
}
