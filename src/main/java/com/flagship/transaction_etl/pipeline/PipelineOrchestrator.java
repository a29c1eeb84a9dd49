package com.flagship.transaction_etl.pipeline;

import com.flagship.transaction_etl.clean.CleaningResult;
import com.flagship.transaction_etl.clean.RecordCleaner;
import com.flagship.transaction_etl.enrich.CategorizedRecord;
import com.flagship.transaction_etl.enrich.Categorizer;
import com.flagship.transaction_etl.enrich.CustomerAggregator;
import com.flagship.transaction_etl.extract.ExtractionRequest;
import com.flagship.transaction_etl.extract.ExtractionResult;
import com.flagship.transaction_etl.extract.PageFailure;
import com.flagship.transaction_etl.extract.TransactionExtractor;
import com.flagship.transaction_etl.load.BatchOutcome;
import com.flagship.transaction_etl.load.LoadReport;
import com.flagship.transaction_etl.load.StoreConnectivityCheck;
import com.flagship.transaction_etl.load.StoreUnavailableException;
import com.flagship.transaction_etl.load.TransactionLoader;
import com.flagship.transaction_etl.observability.PipelineMetrics;
import com.flagship.transaction_etl.observability.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs extract, clean, categorize and load in sequence and reports one {@link RunSummary}.
 *
 * Flow:
 * 1. Check the store; an unreachable store fails the run before the source is called
 * 2. Extract all pages of the requested window (failed pages are recorded, not fatal)
 * 3. Clean and deduplicate, categorize, roll up per customer
 * 4. Load in independent batches
 *
 * {@link #run} never throws: every failure ends up in the summary's error list.
 * Only one run executes at a time; a concurrent trigger gets a {@link RunStatus#SKIPPED} summary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {

    private final StoreConnectivityCheck connectivityCheck;
    private final TransactionExtractor extractor;
    private final RecordCleaner cleaner;
    private final Categorizer categorizer;
    private final CustomerAggregator aggregator;
    private final TransactionLoader loader;
    private final RunHistory runHistory;
    private final PipelineMetrics metrics;

    private final ReentrantLock runLock = new ReentrantLock();

    public RunSummary runDefault() {
        return run(extractor.defaultRequest());
    }

    public RunSummary run(ExtractionRequest request) {
        String runId = RunContext.generateId();
        Instant startedAt = Instant.now();

        if (!runLock.tryLock()) {
            log.warn("Run {} for {} skipped: another run is in progress", runId, request);
            RunSummary skipped = RunSummary.builder()
                    .runId(runId)
                    .status(RunStatus.SKIPPED)
                    .startedAt(startedAt)
                    .finishedAt(startedAt)
                    .elapsed(Duration.ZERO)
                    .requestedWindow(request.toString())
                    .errors(List.of("Another pipeline run is in progress"))
                    .build();
            metrics.recordRun(skipped);
            return skipped;
        }

        try (MDC.MDCCloseable ignored = RunContext.openRun(runId)) {
            log.info("Pipeline run started for window {}", request);

            RunSummary.RunSummaryBuilder summary = RunSummary.builder()
                    .runId(runId)
                    .startedAt(startedAt)
                    .requestedWindow(request.toString());
            List<String> errors = new ArrayList<>();

            RunStatus status = execute(request, summary, errors);

            Instant finishedAt = Instant.now();
            RunSummary result = summary
                    .status(status)
                    .finishedAt(finishedAt)
                    .elapsed(Duration.between(startedAt, finishedAt))
                    .errors(List.copyOf(errors))
                    .build();

            runHistory.record(result);
            metrics.recordRun(result);
            log.info("Pipeline run finished: status={}, extracted={}, accepted={}, duplicates={}, rejected={}, " +
                            "loaded={}, failedBatchRecords={}, notAttempted={}, elapsed={}ms",
                    result.getStatus(), result.getExtracted(), result.getAccepted(), result.getDuplicates(),
                    result.getRejected(), result.getLoaded(), result.getFailedBatchRecords(),
                    result.getNotAttempted(), result.getElapsed().toMillis());
            return result;

        } finally {
            runLock.unlock();
        }
    }

    private RunStatus execute(ExtractionRequest request, RunSummary.RunSummaryBuilder summary, List<String> errors) {
        try {
            connectivityCheck.verifyReachable();

            ExtractionResult extraction = extractor.extract(request);
            summary.extracted(extraction.getRecords().size())
                    .pageFailures(extraction.getPageFailures());
            for (PageFailure failure : extraction.getPageFailures()) {
                errors.add(String.format("Page %d failed after %d attempts: %s",
                        failure.getPage(), failure.getAttempts(), failure.getMessage()));
            }

            CleaningResult cleaning = cleaner.clean(extraction.getRecords());
            summary.accepted(cleaning.acceptedCount())
                    .duplicates(cleaning.getDuplicates())
                    .rejected(cleaning.rejectedCount())
                    .rejectedByReason(cleaning.rejectedByReason());

            List<CategorizedRecord> categorized = categorizer.categorizeAll(cleaning.getRecords());
            summary.customerTotals(aggregator.aggregate(categorized));

            LoadReport load = loader.load(categorized);
            summary.loaded(load.loadedCount())
                    .failedBatchRecords(load.failedRecordCount())
                    .notAttempted(load.getNotAttempted())
                    .batchesCommitted(load.committedBatches())
                    .batchesFailed(load.failedBatches());
            for (BatchOutcome batch : load.getBatches()) {
                if (!batch.isCommitted()) {
                    errors.add(String.format("Batch %d (%d records) rolled back: %s",
                            batch.getIndex(), batch.getSize(), batch.getError()));
                }
            }

            if (load.isAborted()) {
                errors.add(String.format("Store unreachable, %d records not attempted: %s",
                        load.getNotAttempted(), load.getFatalError()));
                return RunStatus.FAILED;
            }
            return errors.isEmpty() ? RunStatus.COMPLETED : RunStatus.COMPLETED_WITH_ERRORS;

        } catch (StoreUnavailableException e) {
            errors.add(e.getMessage());
            return RunStatus.FAILED;

        } catch (RuntimeException e) {
            log.error("Pipeline run aborted by unexpected error", e);
            errors.add("Unexpected failure: " + NestedExceptionUtils.getMostSpecificCause(e).getMessage());
            return RunStatus.FAILED;
        }
    }
}
