package com.consent.reconciliation.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Status of one catalog version for one participant.
 * Only {@link Kind#SIGNED} carries a date.
 */
public record ConsentStatus(Kind kind, LocalDate signedDate) {

    public static final String CHECK = "CHECK";
    public static final String NOT_APPLICABLE_TEXT = "n.a.";

    private static final ConsentStatus NEEDS_VERIFICATION = new ConsentStatus(Kind.NEEDS_VERIFICATION, null);
    private static final ConsentStatus NOT_APPLICABLE = new ConsentStatus(Kind.NOT_APPLICABLE, null);

    public enum Kind {
        /** A signature event resolved to this version. */
        SIGNED,

        /** The version became effective while the participant was active, but no signature matched. */
        NEEDS_VERIFICATION,

        /** The version was never required from this participant. */
        NOT_APPLICABLE
    }

    public ConsentStatus {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == Kind.SIGNED && signedDate == null) {
            throw new IllegalArgumentException("signedDate is required for SIGNED");
        }
        if (kind != Kind.SIGNED && signedDate != null) {
            throw new IllegalArgumentException("signedDate is only allowed for SIGNED");
        }
    }

    public static ConsentStatus signed(LocalDate date) {
        return new ConsentStatus(Kind.SIGNED, date);
    }

    public static ConsentStatus needsVerification() {
        return NEEDS_VERIFICATION;
    }

    public static ConsentStatus notApplicable() {
        return NOT_APPLICABLE;
    }

    public boolean isSigned() {
        return kind == Kind.SIGNED;
    }

    /**
     * Renders the status the way it appears in the report: the ISO signature date,
     * {@code CHECK} or {@code n.a.}.
     */
    public String render() {
        return switch (kind) {
            case SIGNED -> signedDate.toString();
            case NEEDS_VERIFICATION -> CHECK;
            case NOT_APPLICABLE -> NOT_APPLICABLE_TEXT;
        };
    }
}
