package com.consent.reconciliation.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A recorded consent signature of one participant.
 * The date is null when the source value could not be parsed.
 */
public record SignatureEvent(
        String participantId,
        LocalDate date,
        String randoGroup1,
        String randoGroup2
) {
    public SignatureEvent {
        Objects.requireNonNull(participantId, "participantId is required");
    }

    public static SignatureEvent of(String participantId, LocalDate date) {
        return new SignatureEvent(participantId, date, null, null);
    }

    public boolean hasDate() {
        return date != null;
    }
}
