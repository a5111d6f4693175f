package com.consent.reconciliation.core.model;

import java.util.Objects;

/**
 * One line of the consent report: a participant, a catalog version and its status.
 */
public record ReportRow(String participantId, String version, ConsentStatus status, String comment) {
    public ReportRow {
        Objects.requireNonNull(participantId, "participantId is required");
        Objects.requireNonNull(version, "version is required");
        Objects.requireNonNull(status, "status is required");
        comment = comment != null ? comment : "";
    }
}
