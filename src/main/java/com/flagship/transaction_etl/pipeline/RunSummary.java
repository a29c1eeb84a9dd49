package com.flagship.transaction_etl.pipeline;

import com.flagship.transaction_etl.clean.RejectionReason;
import com.flagship.transaction_etl.enrich.CustomerTotals;
import com.flagship.transaction_etl.extract.PageFailure;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline run.
 *
 * Counts reconcile: {@code extracted == accepted + rejected},
 * {@code accepted == duplicates + loaded + failedBatchRecords + notAttempted}.
 */
@Value
@Builder
public class RunSummary {
    String runId;
    RunStatus status;
    Instant startedAt;
    Instant finishedAt;
    Duration elapsed;
    String requestedWindow;

    int extracted;
    int accepted;
    int duplicates;
    int rejected;
    @Builder.Default
    Map<RejectionReason, Integer> rejectedByReason = Map.of();

    int loaded;
    int failedBatchRecords;
    int notAttempted;
    long batchesCommitted;
    long batchesFailed;

    @Builder.Default
    List<PageFailure> pageFailures = List.of();
    @Builder.Default
    List<String> errors = List.of();
    @Builder.Default
    Map<String, CustomerTotals> customerTotals = Map.of();
}
