package com.consent.reconciliation.rules;

import java.util.List;

/**
 * Header synonyms for the export formats the consent report is usually fed with:
 * the ICF catalog workbook (German or English headers) and the EDC exports using
 * {@code mnpaid}, {@code icdat}, {@code eosdat} and {@code dthdat}.
 */
public final class DefaultColumnRules {

    private DefaultColumnRules() {
    }

    public static List<ColumnRule> getRules() {
        return List.of(
                // Catalog
                ColumnRule.builder()
                        .name("icf-version")
                        .pattern("(?=.*icf)(?=.*version)")
                        .field(CanonicalField.VERSION_NAME)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("valid-from")
                        // whole words only: "invalid", "ungültig" and "validated_by" are other columns
                        .pattern("(?<!\\p{L})(gültig|gueltig)|(?<!\\p{L})valid(?!\\p{L})")
                        .field(CanonicalField.EFFECTIVE_FROM)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("effective-from")
                        .pattern("effective")
                        .field(CanonicalField.EFFECTIVE_FROM)
                        .priority(50)
                        .build(),
                ColumnRule.builder()
                        .name("version")
                        .pattern("^version$|^version[ _]?name$")
                        .field(CanonicalField.VERSION_NAME)
                        .priority(50)
                        .build(),

                // Participant tables
                ColumnRule.builder()
                        .name("mnpaid")
                        .pattern("^mnpaid$")
                        .field(CanonicalField.PARTICIPANT_ID)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("participant-id")
                        .pattern("^(participant|patient|subject)[ _-]?id$")
                        .field(CanonicalField.PARTICIPANT_ID)
                        .priority(50)
                        .build(),
                ColumnRule.builder()
                        .name("icdat")
                        .pattern("^icdat$")
                        .field(CanonicalField.SIGNATURE_DATE)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("consent-date")
                        .pattern("^(consent|signature)[ _]?date$")
                        .field(CanonicalField.SIGNATURE_DATE)
                        .priority(50)
                        .build(),
                ColumnRule.builder()
                        .name("rando-group-1")
                        .pattern("^mnp_rando_gr$|^rando(mi[sz]ation)?[ _]?group[ _]?1$")
                        .field(CanonicalField.RANDO_GROUP_1)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("rando-group-2")
                        .pattern("^mnp_rando_v6_gr$|^rando(mi[sz]ation)?[ _]?group[ _]?2$")
                        .field(CanonicalField.RANDO_GROUP_2)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("eosdat")
                        .pattern("^eosdat$|^exit[ _]?date$|^eos[ _]?date$")
                        .field(CanonicalField.EXIT_DATE)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("dthdat")
                        .pattern("^dthdat$|^death[ _]?date$")
                        .field(CanonicalField.DEATH_DATE)
                        .priority(10)
                        .build(),
                ColumnRule.builder()
                        .name("eligible")
                        .pattern("^eligib")
                        .field(CanonicalField.ELIGIBLE)
                        .priority(10)
                        .build()
        );
    }
}
