package com.consent.reconciliation.report;

import java.util.List;

/**
 * The finished report: rendered rows plus the merge spans they were built from.
 */
public record ReportTable(List<ReportTableRow> rows, List<MergeSpan> spans) {

    public static final List<String> HEADERS = List.of(
            "Patient-ID", "Version of Informed Consent Form", "Date of Consent", "Comment");

    public ReportTable {
        rows = rows != null ? List.copyOf(rows) : List.of();
        spans = spans != null ? List.copyOf(spans) : List.of();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
