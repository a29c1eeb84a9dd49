package com.flagship.transaction_etl.load;

import com.flagship.transaction_etl.enrich.CategorizedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads a run's categorized records into the store.
 *
 * Records are split into sequential batches of {@code loader.chunk-size}; each
 * batch is one transaction written by {@link TransactionBatchWriter} and is
 * atomic on its own. A batch that fails is rolled back completely and recorded;
 * later batches still run. A connectivity failure stops loading: the remaining
 * batches are not attempted.
 */
@Service
@Slf4j
public class TransactionLoader {

    private final TransactionBatchWriter batchWriter;
    private final int chunkSize;

    public TransactionLoader(TransactionBatchWriter batchWriter,
                             @Value("${loader.chunk-size:1000}") int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("loader.chunk-size must be positive, was " + chunkSize);
        }
        this.batchWriter = batchWriter;
        this.chunkSize = chunkSize;
    }

    public LoadReport load(List<CategorizedRecord> records) {
        if (records.isEmpty()) {
            log.info("No records to load");
            return LoadReport.empty();
        }

        int batchCount = (records.size() + chunkSize - 1) / chunkSize;
        List<BatchOutcome> outcomes = new ArrayList<>(batchCount);
        log.info("Loading {} records in {} batch(es) of up to {}", records.size(), batchCount, chunkSize);

        for (int index = 0; index < batchCount; index++) {
            int from = index * chunkSize;
            int to = Math.min(from + chunkSize, records.size());
            List<CategorizedRecord> batch = records.subList(from, to);

            try {
                int inserted = batchWriter.writeBatch(batch);
                outcomes.add(BatchOutcome.committed(index, batch.size(), inserted));
                log.info("Batch {}/{} committed: {} transactions", index + 1, batchCount, inserted);

            } catch (RuntimeException e) {
                String reason = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
                outcomes.add(BatchOutcome.rolledBack(index, batch.size(), reason));

                if (StoreFailures.isConnectivityFailure(e)) {
                    int notAttempted = records.size() - to;
                    log.error("Batch {}/{} rolled back, store unreachable; {} records not attempted: {}",
                            index + 1, batchCount, notAttempted, reason, e);
                    return new LoadReport(List.copyOf(outcomes), notAttempted, reason);
                }
                log.error("Batch {}/{} rolled back ({} records): {}", index + 1, batchCount, batch.size(), reason);
            }
        }

        return new LoadReport(List.copyOf(outcomes), 0, null);
    }
}
