package com.flagship.transaction_etl.clean;

import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Partition of a batch of raw records into accepted and rejected.
 *
 * Duplicates are part of the accepted partition (they passed validation) but
 * only their first occurrence is kept in {@link #getRecords()}, which is the
 * stream handed to the categorizer and loader.
 */
@Value
public class CleaningResult {
    List<CleanedRecord> records;
    int duplicates;
    List<Rejection> rejections;

    public int acceptedCount() {
        return records.size() + duplicates;
    }

    public int rejectedCount() {
        return rejections.size();
    }

    public Map<RejectionReason, Integer> rejectedByReason() {
        Map<RejectionReason, Integer> counts = new EnumMap<>(RejectionReason.class);
        for (Rejection rejection : rejections) {
            counts.merge(rejection.getReason(), 1, Integer::sum);
        }
        return counts;
    }

    public static CleaningResult empty() {
        return new CleaningResult(List.of(), 0, List.of());
    }
}
