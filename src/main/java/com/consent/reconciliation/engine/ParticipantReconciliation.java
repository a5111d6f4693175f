package com.consent.reconciliation.engine;

import com.consent.reconciliation.core.model.ConsentStatus;

import java.util.List;
import java.util.Objects;

/**
 * Engine output for one participant: one status per catalog version, in catalog order.
 */
public record ParticipantReconciliation(String participantId, List<VersionStatus> statuses) {
    public ParticipantReconciliation {
        Objects.requireNonNull(participantId, "participantId is required");
        statuses = statuses != null ? List.copyOf(statuses) : List.of();
    }

    public long count(ConsentStatus.Kind kind) {
        return statuses.stream().filter(s -> s.status().kind() == kind).count();
    }

    public boolean needsVerification() {
        return count(ConsentStatus.Kind.NEEDS_VERIFICATION) > 0;
    }
}
