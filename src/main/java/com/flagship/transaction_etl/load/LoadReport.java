package com.flagship.transaction_etl.load;

import lombok.Value;

import java.util.List;

/**
 * Outcome of loading a run's records, batch by batch.
 *
 * When the store becomes unreachable the loader stops: {@code fatalError} is set
 * and the records of the batches it never started are counted in {@code notAttempted}.
 */
@Value
public class LoadReport {
    List<BatchOutcome> batches;
    int notAttempted;
    String fatalError;

    public static LoadReport empty() {
        return new LoadReport(List.of(), 0, null);
    }

    public int loadedCount() {
        return batches.stream().mapToInt(BatchOutcome::getInserted).sum();
    }

    public int failedRecordCount() {
        return batches.stream().filter(batch -> !batch.isCommitted()).mapToInt(BatchOutcome::getSize).sum();
    }

    public long committedBatches() {
        return batches.stream().filter(BatchOutcome::isCommitted).count();
    }

    public long failedBatches() {
        return batches.stream().filter(batch -> !batch.isCommitted()).count();
    }

    public boolean isAborted() {
        return fatalError != null;
    }
}
