package com.consent.reconciliation.engine;

import com.consent.reconciliation.catalog.LookupMode;
import com.consent.reconciliation.catalog.VersionCatalog;
import com.consent.reconciliation.core.model.CatalogVersion;
import com.consent.reconciliation.core.model.ConsentStatus;
import com.consent.reconciliation.core.model.ParticipantTimeline;
import com.consent.reconciliation.core.model.SignatureEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationEngineTest {

    private static final LocalDate V1_FROM = LocalDate.of(2020, 1, 1);
    private static final LocalDate V2_FROM = LocalDate.of(2021, 1, 1);

    private static final VersionCatalog TWO_VERSIONS = VersionCatalog.of(List.of(
            new CatalogVersion("V1", V1_FROM),
            new CatalogVersion("V2", V2_FROM)), LookupMode.INTERVAL);

    private final ReconciliationEngine engine = new ReconciliationEngine(TWO_VERSIONS);

    private static ParticipantTimeline.Builder participant(String id, LocalDate... signatures) {
        ParticipantTimeline.Builder builder = ParticipantTimeline.builder(id);
        for (LocalDate date : signatures) {
            builder.event(SignatureEvent.of(id, date));
        }
        return builder;
    }

    private static List<String> rendered(ParticipantReconciliation result) {
        return result.statuses().stream().map(s -> s.status().render()).toList();
    }

    @Nested
    @DisplayName("Reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("A: signed V1 only while active -> V2 needs verification")
        void scenarioA() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2020, 6, 1)).build());

            assertEquals(List.of("2020-06-01", "CHECK"), rendered(result));
            assertTrue(result.needsVerification());
        }

        @Test
        @DisplayName("B: exit before V2 became effective -> V2 not applicable")
        void scenarioB() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2020, 6, 1))
                            .exitDate(LocalDate.of(2020, 12, 1))
                            .build());

            assertEquals(List.of("2020-06-01", "n.a."), rendered(result));
        }

        @Test
        @DisplayName("C: ineligible participant without signatures -> all not applicable")
        void scenarioC() {
            ParticipantReconciliation result = engine.reconcile(participant("P1").eligible(false).build());

            assertEquals(List.of("n.a.", "n.a."), rendered(result));
            assertEquals(0, result.count(ConsentStatus.Kind.NEEDS_VERIFICATION));
        }

        @Test
        @DisplayName("D: death after both signatures -> both signed, never CHECK")
        void scenarioD() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2020, 2, 3), LocalDate.of(2021, 1, 15))
                            .deathDate(LocalDate.of(2021, 3, 1))
                            .build());

            assertEquals(List.of("2020-02-03", "2021-01-15"), rendered(result));
        }

        @Test
        @DisplayName("E: tied-latest lookup signs every version of the shared date")
        void scenarioE() {
            VersionCatalog tied = VersionCatalog.of(List.of(
                    new CatalogVersion("VA", LocalDate.of(2022, 1, 1)),
                    new CatalogVersion("VB", LocalDate.of(2022, 1, 1))), LookupMode.TIED_LATEST);

            ParticipantReconciliation result = new ReconciliationEngine(tied).reconcile(
                    participant("P1", LocalDate.of(2022, 2, 1)).build());

            assertEquals(List.of("2022-02-01", "2022-02-01"), rendered(result));
            assertEquals(2, result.count(ConsentStatus.Kind.SIGNED));
        }
    }

    @Nested
    @DisplayName("Signed versions")
    class SignedVersions {

        @Test
        @DisplayName("Several signatures of one version keep the earliest date")
        void earliestDateWins() {
            ParticipantTimeline timeline = participant("P1",
                    LocalDate.of(2020, 9, 1), LocalDate.of(2020, 3, 1), LocalDate.of(2020, 11, 30)).build();

            ParticipantReconciliation result = engine.reconcile(timeline);

            assertEquals(ConsentStatus.signed(LocalDate.of(2020, 3, 1)), result.statuses().get(0).status());
        }

        @Test
        @DisplayName("A later signature does not hide an earlier signed version")
        void laterSignatureKeepsEarlier() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2020, 5, 1), LocalDate.of(2021, 5, 1)).build());

            assertEquals(List.of("2020-05-01", "2021-05-01"), rendered(result));
        }

        @Test
        @DisplayName("Signed takes precedence over ineligibility")
        void signedBeforeIneligible() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2020, 5, 1)).eligible(false).build());

            assertEquals(List.of("2020-05-01", "n.a."), rendered(result));
        }

        @Test
        @DisplayName("Signature before the first version resolves to nothing")
        void signatureBeforeCatalog() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2019, 5, 1)).build());

            assertEquals(List.of("CHECK", "CHECK"), rendered(result));
        }
    }

    @Nested
    @DisplayName("Verification requests")
    class Verification {

        @Test
        @DisplayName("Participant without any signature needs every version effective before exit")
        void noEventsNeedsVerification() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1").exitDate(LocalDate.of(2020, 7, 1)).build());

            assertEquals(List.of("CHECK", "n.a."), rendered(result));
        }

        @Test
        @DisplayName("Exit on the effective date still requires the version")
        void exitOnEffectiveDate() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2020, 6, 1)).exitDate(V2_FROM).build());

            assertEquals(List.of("2020-06-01", "CHECK"), rendered(result));
        }

        @Test
        @DisplayName("Version superseded before the last signature is not applicable")
        void supersededVersion() {
            VersionCatalog three = VersionCatalog.of(List.of(
                    new CatalogVersion("V1", V1_FROM),
                    new CatalogVersion("V2", V2_FROM),
                    new CatalogVersion("V3", LocalDate.of(2022, 1, 1))), LookupMode.INTERVAL);

            ParticipantReconciliation result = new ReconciliationEngine(three).reconcile(
                    participant("P1", LocalDate.of(2022, 3, 1)).build());

            assertEquals(List.of("n.a.", "n.a.", "2022-03-01"), rendered(result));
        }

        @Test
        @DisplayName("Death date alone does not end participation")
        void deathDoesNotSuppressCheck() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1", LocalDate.of(2020, 6, 1)).deathDate(LocalDate.of(2020, 8, 1)).build());

            assertEquals(List.of("2020-06-01", "CHECK"), rendered(result));
        }

        @Test
        @DisplayName("Ineligible participants never need verification")
        void ineligibleNeverCheck() {
            ParticipantReconciliation result = engine.reconcile(
                    participant("P1").eligible(false).exitDate(LocalDate.of(2030, 1, 1)).build());

            assertFalse(result.needsVerification());
        }

        @Test
        @DisplayName("Events without any usable date yield no verification requests")
        void undatedEvents() {
            ParticipantTimeline timeline = ParticipantTimeline.builder("P1")
                    .event(SignatureEvent.of("P1", null))
                    .event(SignatureEvent.of("P1", null))
                    .build();

            assertEquals(List.of("n.a.", "n.a."), rendered(engine.reconcile(timeline)));
        }
    }

    @Test
    @DisplayName("One status per catalog version, in catalog order")
    void oneStatusPerVersion() {
        ParticipantReconciliation result = engine.reconcile(participant("P1", LocalDate.of(2021, 2, 1)).build());

        assertEquals(TWO_VERSIONS.size(), result.statuses().size());
        assertEquals("V1", result.statuses().get(0).version().name());
        assertEquals("V2", result.statuses().get(1).version().name());
    }

    @Test
    @DisplayName("Reconciling twice yields identical results")
    void idempotent() {
        ParticipantTimeline timeline = participant("P1", LocalDate.of(2020, 6, 1))
                .exitDate(LocalDate.of(2021, 6, 1))
                .build();

        assertEquals(engine.reconcile(timeline), engine.reconcile(timeline));
    }

    @Test
    @DisplayName("Empty catalog yields no statuses")
    void emptyCatalog() {
        ReconciliationEngine empty = new ReconciliationEngine(VersionCatalog.of(List.of(), LookupMode.INTERVAL));

        assertTrue(empty.reconcile(participant("P1", LocalDate.of(2020, 1, 1)).build()).statuses().isEmpty());
    }
}
