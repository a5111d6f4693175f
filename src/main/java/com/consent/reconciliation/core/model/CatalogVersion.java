package com.consent.reconciliation.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A named revision of the consent form together with the date from which
 * participants must sign it.
 *
 * @param name          the version label as it appears in the catalog
 * @param effectiveFrom the first day this version is in force
 */
public record CatalogVersion(String name, LocalDate effectiveFrom) {
    public CatalogVersion {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        Objects.requireNonNull(effectiveFrom, "effectiveFrom is required");
    }
}
