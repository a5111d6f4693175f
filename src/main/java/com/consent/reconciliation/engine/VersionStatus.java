package com.consent.reconciliation.engine;

import com.consent.reconciliation.core.model.CatalogVersion;
import com.consent.reconciliation.core.model.ConsentStatus;

import java.util.Objects;

/**
 * The status the engine assigned to one catalog version.
 */
public record VersionStatus(CatalogVersion version, ConsentStatus status) {
    public VersionStatus {
        Objects.requireNonNull(version, "version is required");
        Objects.requireNonNull(status, "status is required");
    }
}
