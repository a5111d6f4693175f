package com.consent.reconciliation.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * End-of-study information for a participant. Both dates are optional and independent.
 */
public record ExitRecord(String participantId, LocalDate exitDate, LocalDate deathDate) {
    public ExitRecord {
        Objects.requireNonNull(participantId, "participantId is required");
    }
}
