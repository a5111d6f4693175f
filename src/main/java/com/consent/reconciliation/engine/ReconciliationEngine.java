package com.consent.reconciliation.engine;

import com.consent.reconciliation.catalog.VersionCatalog;
import com.consent.reconciliation.core.model.CatalogVersion;
import com.consent.reconciliation.core.model.ConsentStatus;
import com.consent.reconciliation.core.model.ParticipantTimeline;
import com.consent.reconciliation.core.model.SignatureEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies every catalog version against one participant's timeline.
 *
 * <p>Per version, in catalog order:</p>
 * <ol>
 *   <li>a signature resolved to the version: {@code SIGNED} with the earliest such date</li>
 *   <li>the participant failed screening: {@code NOT_APPLICABLE}</li>
 *   <li>the version became effective after the last signature and not after the exit
 *       date: {@code NEEDS_VERIFICATION}</li>
 *   <li>otherwise: {@code NOT_APPLICABLE}</li>
 * </ol>
 *
 * <p>A participant without any signature event counts as never having signed, so every
 * version effective before the exit needs verification. A participant whose events all
 * lack a date has no reference point and gets no verification requests.</p>
 *
 * <p>The engine is stateless and safe to share between threads.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final VersionCatalog catalog;

    public ReconciliationEngine(VersionCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
    }

    public VersionCatalog getCatalog() {
        return catalog;
    }

    /**
     * Computes the status of every catalog version for the given participant.
     */
    public ParticipantReconciliation reconcile(ParticipantTimeline timeline) {
        Map<String, LocalDate> signedVersions = signedVersions(timeline);
        LocalDate exitDate = timeline.getExitDate().orElse(null);

        // No events at all behaves like a last signature at minus infinity
        boolean neverSigned = !timeline.hasEvents();
        LocalDate lastSignature = timeline.lastSignatureDate().orElse(null);

        List<VersionStatus> statuses = new ArrayList<>(catalog.size());
        for (CatalogVersion version : catalog.versions()) {
            LocalDate signedOn = signedVersions.get(version.name());
            ConsentStatus status;
            if (signedOn != null) {
                status = ConsentStatus.signed(signedOn);
            } else if (!timeline.isEligible()) {
                status = ConsentStatus.notApplicable();
            } else if (becameEffectiveAfter(version, lastSignature, neverSigned)
                    && activeOn(version, exitDate)) {
                status = ConsentStatus.needsVerification();
            } else {
                status = ConsentStatus.notApplicable();
            }
            statuses.add(new VersionStatus(version, status));
        }

        ParticipantReconciliation result = new ParticipantReconciliation(timeline.getParticipantId(), statuses);
        log.debug("participant.reconciled participantId={} signed={} check={} na={}",
                timeline.getParticipantId(),
                result.count(ConsentStatus.Kind.SIGNED),
                result.count(ConsentStatus.Kind.NEEDS_VERIFICATION),
                result.count(ConsentStatus.Kind.NOT_APPLICABLE));
        return result;
    }

    /**
     * Maps each version name to the earliest signature date that resolved to it.
     * In tied-latest mode one date may resolve to several names; all are recorded.
     */
    Map<String, LocalDate> signedVersions(ParticipantTimeline timeline) {
        Map<String, LocalDate> signed = new LinkedHashMap<>();
        for (SignatureEvent event : timeline.getEvents()) {
            if (!event.hasDate()) {
                continue;
            }
            for (String name : catalog.applicableVersions(event.date())) {
                signed.merge(name, event.date(), (existing, candidate) ->
                        candidate.isBefore(existing) ? candidate : existing);
            }
        }
        return signed;
    }

    private static boolean becameEffectiveAfter(CatalogVersion version, LocalDate lastSignature, boolean neverSigned) {
        if (neverSigned) {
            return true;
        }
        return lastSignature != null && version.effectiveFrom().isAfter(lastSignature);
    }

    private static boolean activeOn(CatalogVersion version, LocalDate exitDate) {
        return exitDate == null || !exitDate.isBefore(version.effectiveFrom());
    }
}
