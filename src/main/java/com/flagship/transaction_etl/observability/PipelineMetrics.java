package com.flagship.transaction_etl.observability;

import com.flagship.transaction_etl.pipeline.RunStatus;
import com.flagship.transaction_etl.pipeline.RunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Micrometer meters for pipeline runs.
 *
 * Metrics exposed:
 * - etl.records.extracted / accepted / duplicates / loaded: record counters
 * - etl.records.rejected: counter tagged by rejection reason
 * - etl.pages.failed: pages given up on after retries
 * - etl.batches.committed / failed: loader sub-transactions
 * - etl.runs: counter tagged by run status
 * - etl.run.duration: timer per completed run
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry registry;

    private final Counter recordsExtracted;
    private final Counter recordsAccepted;
    private final Counter recordsDuplicate;
    private final Counter recordsLoaded;
    private final Counter pagesFailed;
    private final Counter batchesCommitted;
    private final Counter batchesFailed;

    private final Timer runTimer;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.recordsExtracted = Counter.builder("etl.records.extracted")
                .description("Raw records received from the source")
                .register(registry);

        this.recordsAccepted = Counter.builder("etl.records.accepted")
                .description("Records that passed validation, duplicates included")
                .register(registry);

        this.recordsDuplicate = Counter.builder("etl.records.duplicates")
                .description("Accepted records dropped as duplicates")
                .register(registry);

        this.recordsLoaded = Counter.builder("etl.records.loaded")
                .description("Fact rows committed to the store")
                .register(registry);

        this.pagesFailed = Counter.builder("etl.pages.failed")
                .description("Source pages abandoned after retries")
                .register(registry);

        this.batchesCommitted = Counter.builder("etl.batches.committed")
                .description("Loader sub-transactions committed")
                .register(registry);

        this.batchesFailed = Counter.builder("etl.batches.failed")
                .description("Loader sub-transactions rolled back")
                .register(registry);

        this.runTimer = Timer.builder("etl.run.duration")
                .description("Wall-clock time of a pipeline run")
                .publishPercentiles(0.5, 0.95)
                .register(registry);
    }

    /**
     * Folds a finished run into the meters. Skipped triggers only count towards {@code etl.runs}.
     */
    public void recordRun(RunSummary summary) {
        registry.counter("etl.runs", "status", summary.getStatus().name().toLowerCase(Locale.ROOT)).increment();
        if (summary.getStatus() == RunStatus.SKIPPED) {
            return;
        }

        recordsExtracted.increment(summary.getExtracted());
        recordsAccepted.increment(summary.getAccepted());
        recordsDuplicate.increment(summary.getDuplicates());
        recordsLoaded.increment(summary.getLoaded());
        pagesFailed.increment(summary.getPageFailures().size());
        batchesCommitted.increment(summary.getBatchesCommitted());
        batchesFailed.increment(summary.getBatchesFailed());

        summary.getRejectedByReason().forEach((reason, count) ->
                registry.counter("etl.records.rejected", "reason", reason.name().toLowerCase(Locale.ROOT))
                        .increment(count));

        runTimer.record(summary.getElapsed());
    }
}
