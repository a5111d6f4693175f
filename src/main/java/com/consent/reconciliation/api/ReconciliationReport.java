package com.consent.reconciliation.api;

import com.consent.reconciliation.core.model.ConsentStatus;
import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.core.model.ReportRow;
import com.consent.reconciliation.report.ReportTable;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a report run: the per-version rows, the merged table for rendering and the
 * data-quality warnings carried over from input normalization.
 */
public record ReconciliationReport(
        String runId,
        int participantCount,
        List<ReportRow> rows,
        ReportTable table,
        List<DataQualityWarning> warnings
) {
    public ReconciliationReport {
        rows = rows != null ? List.copyOf(rows) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public Map<ConsentStatus.Kind, Long> statusCounts() {
        Map<ConsentStatus.Kind, Long> counts = new EnumMap<>(ConsentStatus.Kind.class);
        for (ConsentStatus.Kind kind : ConsentStatus.Kind.values()) {
            counts.put(kind, 0L);
        }
        for (ReportRow row : rows) {
            counts.merge(row.status().kind(), 1L, Long::sum);
        }
        return counts;
    }

    public List<ReportRow> rowsFor(String participantId) {
        return rows.stream().filter(r -> r.participantId().equals(participantId)).toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "ReconciliationReport{" +
                "runId='" + runId + '\'' +
                ", participants=" + participantCount +
                ", rows=" + rows.size() +
                ", spans=" + table.spans().size() +
                ", warnings=" + warnings.size() +
                '}';
    }
}
