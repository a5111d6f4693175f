package com.consent.reconciliation.report;

import com.consent.reconciliation.core.model.ReportRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses runs of adjacent rows that share a participant into one visual block.
 *
 * <p>Only neighbouring rows are compared. Rows must therefore arrive grouped by
 * participant; a participant split across two runs yields two spans.</p>
 */
public class RunMerger {

    /**
     * Finds the maximal runs of adjacent rows with equal participant id.
     * The row counts of the returned spans add up to {@code rows.size()}.
     */
    public List<MergeSpan> spans(List<ReportRow> rows) {
        List<MergeSpan> spans = new ArrayList<>();
        int start = 0;
        while (start < rows.size()) {
            String participantId = rows.get(start).participantId();
            int end = start + 1;
            while (end < rows.size() && rows.get(end).participantId().equals(participantId)) {
                end++;
            }
            spans.add(new MergeSpan(participantId, start, end - start));
            start = end;
        }
        return spans;
    }

    /**
     * Builds the report table: the first row of each span carries the participant id
     * and comment, the remaining rows carry blanks for those two cells.
     */
    public ReportTable merge(List<ReportRow> rows) {
        List<MergeSpan> spans = spans(rows);
        List<ReportTableRow> tableRows = new ArrayList<>(rows.size());
        for (MergeSpan span : spans) {
            for (int i = span.startRow(); i < span.endRow(); i++) {
                ReportRow row = rows.get(i);
                boolean first = i == span.startRow();
                tableRows.add(new ReportTableRow(
                        first ? row.participantId() : "",
                        row.version(),
                        row.status().render(),
                        first ? row.comment() : "",
                        first ? span.rowCount() : 0));
            }
        }
        return new ReportTable(tableRows, spans);
    }
}
