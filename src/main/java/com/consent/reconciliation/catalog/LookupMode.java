package com.consent.reconciliation.catalog;

/**
 * How a {@link VersionCatalog} resolves a date to the versions in force.
 */
public enum LookupMode {
    /**
     * Each version covers {@code [effectiveFrom, nextEffectiveFrom)}.
     * At most one version applies to a date; among versions sharing an effective
     * date the last one in catalog order wins.
     */
    INTERVAL,

    /**
     * All versions sharing the latest {@code effectiveFrom <= date} apply together,
     * e.g. language variants released on the same day.
     */
    TIED_LATEST
}
