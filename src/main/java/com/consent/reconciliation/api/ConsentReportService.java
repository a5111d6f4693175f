package com.consent.reconciliation.api;

import com.consent.reconciliation.catalog.VersionCatalog;
import com.consent.reconciliation.comment.CommentComposer;
import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.core.model.ParticipantTimeline;
import com.consent.reconciliation.core.model.ReportRow;
import com.consent.reconciliation.engine.ParticipantReconciliation;
import com.consent.reconciliation.engine.ReconciliationEngine;
import com.consent.reconciliation.logging.LogContext;
import com.consent.reconciliation.metrics.MetricsService;
import com.consent.reconciliation.metrics.NoOpMetricsService;
import com.consent.reconciliation.report.ReportTable;
import com.consent.reconciliation.report.RowEmitter;
import com.consent.reconciliation.report.RunMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Service facade running a consent report: builds the catalog and the participant
 * timelines, reconciles every participant, emits the rows and merges them for rendering.
 *
 * <p>Participants are independent of each other. With {@code parallelism > 1} they are
 * reconciled on a fixed thread pool; results are always collected in participant order,
 * so the merged table is identical to a single-threaded run.</p>
 */
public class ConsentReportService {
    private static final Logger log = LoggerFactory.getLogger(ConsentReportService.class);

    private final ReconciliationOptions options;
    private final MetricsService metricsService;
    private final TimelineAssembler timelineAssembler;
    private final CommentComposer commentComposer;
    private final RowEmitter rowEmitter;
    private final RunMerger runMerger;

    public ConsentReportService() {
        this(ReconciliationOptions.defaults());
    }

    public ConsentReportService(ReconciliationOptions options) {
        this(options, new NoOpMetricsService());
    }

    public ConsentReportService(ReconciliationOptions options, MetricsService metricsService) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.timelineAssembler = new TimelineAssembler();
        this.commentComposer = new CommentComposer(options.getMissingGroupPlaceholder(),
                options.getScreeningFailureText());
        this.rowEmitter = new RowEmitter();
        this.runMerger = new RunMerger();
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    /**
     * Runs a report over the given inputs.
     *
     * @param inputs the normalized catalog, signature, exit and eligibility records
     * @return the report
     * @throws CatalogConfigurationException if the catalog is empty
     */
    public ReconciliationReport generate(ConsentInputs inputs) {
        Objects.requireNonNull(inputs, "inputs is required");
        if (inputs.catalog().isEmpty()) {
            throw new CatalogConfigurationException("The version catalog is empty; nothing to reconcile against");
        }

        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forReport(runId)) {
            VersionCatalog catalog = VersionCatalog.of(inputs.catalog(), options.getLookupMode());
            ReconciliationEngine engine = new ReconciliationEngine(catalog);
            List<ParticipantTimeline> timelines = timelineAssembler.assemble(inputs, options.getParticipantOrder());
            log.info("report.started versions={} participants={} options={}",
                    catalog.size(), timelines.size(), options);

            List<List<ReportRow>> perParticipant = options.getParallelism() > 1 && timelines.size() > 1
                    ? reconcileParallel(runId, engine, timelines)
                    : reconcileSequential(runId, engine, timelines);

            List<ReportRow> rows = new ArrayList<>();
            perParticipant.forEach(rows::addAll);
            ReportTable table = runMerger.merge(rows);

            recordMetrics(rows, timelines.size(), inputs.warnings());
            ReconciliationReport report = new ReconciliationReport(runId, timelines.size(), rows, table,
                    inputs.warnings());
            if (report.hasWarnings()) {
                log.warn("report.data.warnings count={}", report.warnings().size());
            }
            log.info("report.completed participants={} rows={} statuses={}",
                    timelines.size(), rows.size(), report.statusCounts());
            return report;
        } finally {
            metricsService.recordReportDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private List<List<ReportRow>> reconcileSequential(String runId, ReconciliationEngine engine,
                                                      List<ParticipantTimeline> timelines) {
        List<List<ReportRow>> result = new ArrayList<>(timelines.size());
        for (ParticipantTimeline timeline : timelines) {
            result.add(reconcileParticipant(runId, engine, timeline));
        }
        return result;
    }

    private List<List<ReportRow>> reconcileParallel(String runId, ReconciliationEngine engine,
                                                    List<ParticipantTimeline> timelines) {
        int threads = Math.min(options.getParallelism(), timelines.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<List<ReportRow>>> futures = timelines.stream()
                    .map(timeline -> CompletableFuture.supplyAsync(
                            () -> reconcileParticipant(runId, engine, timeline), executor))
                    .toList();

            // Joining in submission order keeps the participant order of the timelines
            List<List<ReportRow>> result = new ArrayList<>(futures.size());
            for (CompletableFuture<List<ReportRow>> future : futures) {
                result.add(future.join());
            }
            return result;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private List<ReportRow> reconcileParticipant(String runId, ReconciliationEngine engine,
                                                 ParticipantTimeline timeline) {
        try (LogContext ctx = LogContext.forParticipant(runId, timeline.getParticipantId())) {
            ParticipantReconciliation reconciliation = engine.reconcile(timeline);
            String comment = commentComposer.compose(timeline);
            return rowEmitter.emit(reconciliation, comment);
        }
    }

    private void recordMetrics(List<ReportRow> rows, int participants, List<DataQualityWarning> warnings) {
        metricsService.recordParticipantCount(participants);
        for (ReportRow row : rows) {
            metricsService.incrementStatus(row.status().kind());
        }
        for (DataQualityWarning warning : warnings) {
            metricsService.incrementDataQualityWarning(warning.table());
        }
    }
}
