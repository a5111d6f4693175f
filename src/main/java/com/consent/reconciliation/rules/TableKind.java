package com.consent.reconciliation.rules;

/**
 * The three input tables of a report run.
 */
public enum TableKind {
    /** Consent form versions with their effective dates. */
    CATALOG("catalog"),

    /** Signature events per participant. */
    SIGNATURES("signatures"),

    /** End-of-study, death and screening data per participant. */
    EXITS("exits");

    private final String label;

    TableKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
