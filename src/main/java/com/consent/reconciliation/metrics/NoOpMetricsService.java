package com.consent.reconciliation.metrics;

import com.consent.reconciliation.core.model.ConsentStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReportDuration(Duration duration) {
    }

    @Override
    public void recordParticipantCount(int participants) {
    }

    @Override
    public void incrementStatus(ConsentStatus.Kind kind) {
    }

    @Override
    public void incrementDataQualityWarning(String table) {
    }
}
