package com.consent.reconciliation.rules;

/**
 * Column meanings the importers understand, independent of how a study names them.
 */
public enum CanonicalField {
    VERSION_NAME(TableKind.CATALOG, true),
    EFFECTIVE_FROM(TableKind.CATALOG, true),
    PARTICIPANT_ID(null, true),
    SIGNATURE_DATE(TableKind.SIGNATURES, true),
    RANDO_GROUP_1(TableKind.SIGNATURES, false),
    RANDO_GROUP_2(TableKind.SIGNATURES, false),
    EXIT_DATE(TableKind.EXITS, false),
    DEATH_DATE(TableKind.EXITS, false),
    ELIGIBLE(TableKind.EXITS, false);

    private final TableKind table;
    private final boolean required;

    CanonicalField(TableKind table, boolean required) {
        this.table = table;
        this.required = required;
    }

    /**
     * Returns true if the field can appear in the given table.
     * The participant id appears in every participant table.
     */
    public boolean belongsTo(TableKind kind) {
        if (table == null) {
            return kind != TableKind.CATALOG;
        }
        return table == kind;
    }

    public boolean isRequired() {
        return required;
    }
}
