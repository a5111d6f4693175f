package com.consent.reconciliation.report;

/**
 * A row as handed to document rendering. The participant and comment cells are
 * blank on every row but the first of a merge span; {@code rowSpan} is the span
 * length on that first row and 0 elsewhere.
 */
public record ReportTableRow(
        String participantCell,
        String version,
        String status,
        String commentCell,
        int rowSpan
) {
    public boolean startsSpan() {
        return rowSpan > 0;
    }
}
