package com.consent.reconciliation.core.model;

import java.util.Objects;

/**
 * Screening outcome for a participant. A participant without a record is eligible.
 */
public record EligibilityRecord(String participantId, boolean eligible) {
    public EligibilityRecord {
        Objects.requireNonNull(participantId, "participantId is required");
    }
}
