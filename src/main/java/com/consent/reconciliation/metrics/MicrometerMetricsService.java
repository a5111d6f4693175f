package com.consent.reconciliation.metrics;

import com.consent.reconciliation.core.model.ConsentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code consent.report.duration} - Timer</li>
 *   <li>{@code consent.report.participants} - DistributionSummary</li>
 *   <li>{@code consent.status} - Counter (tag: status)</li>
 *   <li>{@code consent.data.warnings} - Counter (tag: table)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Timer reportTimer;
    private final DistributionSummary participantSummary;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.reportTimer = Timer.builder("consent.report.duration")
                .description("Duration of consent report runs")
                .register(registry);
        this.participantSummary = DistributionSummary.builder("consent.report.participants")
                .description("Number of participants per report run")
                .register(registry);
    }

    @Override
    public void recordReportDuration(Duration duration) {
        reportTimer.record(duration);
    }

    @Override
    public void recordParticipantCount(int participants) {
        participantSummary.record(participants);
    }

    @Override
    public void incrementStatus(ConsentStatus.Kind kind) {
        String key = "status:" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("consent.status")
                        .description("Number of report rows per consent status")
                        .tag("status", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementDataQualityWarning(String table) {
        String key = "warning:" + table;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("consent.data.warnings")
                        .description("Number of input values degraded to absent")
                        .tag("table", table)
                        .register(registry));
        counter.increment();
    }
}
