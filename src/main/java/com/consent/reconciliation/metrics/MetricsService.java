package com.consent.reconciliation.metrics;

import com.consent.reconciliation.core.model.ConsentStatus;

import java.time.Duration;

/**
 * Interface for recording report run metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordReportDuration(Duration duration);

    void recordParticipantCount(int participants);

    void incrementStatus(ConsentStatus.Kind kind);

    void incrementDataQualityWarning(String table);
}
