package com.consent.reconciliation.report;

import com.consent.reconciliation.core.model.ReportRow;
import com.consent.reconciliation.engine.ParticipantReconciliation;
import com.consent.reconciliation.engine.VersionStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a participant's reconciliation into report rows, one per catalog version,
 * each carrying the participant-wide comment.
 */
public class RowEmitter {

    public List<ReportRow> emit(ParticipantReconciliation reconciliation, String comment) {
        List<ReportRow> rows = new ArrayList<>(reconciliation.statuses().size());
        for (VersionStatus versionStatus : reconciliation.statuses()) {
            rows.add(new ReportRow(
                    reconciliation.participantId(),
                    versionStatus.version().name(),
                    versionStatus.status(),
                    comment));
        }
        return rows;
    }
}
