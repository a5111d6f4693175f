package com.consent.reconciliation.api;

import com.consent.reconciliation.core.model.CatalogVersion;
import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.core.model.EligibilityRecord;
import com.consent.reconciliation.core.model.ExitRecord;
import com.consent.reconciliation.core.model.SignatureEvent;

import java.util.List;

/**
 * Normalized inputs of one report run, plus the warnings raised while normalizing them.
 */
public record ConsentInputs(
        List<CatalogVersion> catalog,
        List<SignatureEvent> signatures,
        List<ExitRecord> exits,
        List<EligibilityRecord> eligibility,
        List<DataQualityWarning> warnings
) {
    public ConsentInputs {
        catalog = catalog != null ? List.copyOf(catalog) : List.of();
        signatures = signatures != null ? List.copyOf(signatures) : List.of();
        exits = exits != null ? List.copyOf(exits) : List.of();
        eligibility = eligibility != null ? List.copyOf(eligibility) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ConsentInputs of(List<CatalogVersion> catalog, List<SignatureEvent> signatures,
                                   List<ExitRecord> exits, List<EligibilityRecord> eligibility) {
        return new ConsentInputs(catalog, signatures, exits, eligibility, List.of());
    }
}
