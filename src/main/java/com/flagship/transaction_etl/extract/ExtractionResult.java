package com.flagship.transaction_etl.extract;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Raw records pulled from the source plus the pages that were skipped.
 * Records appear in page order; records of a failed page are never included.
 */
@Value
public class ExtractionResult {
    List<Map<String, Object>> records;
    List<PageFailure> pageFailures;
    int pagesFetched;

    public boolean hasPageFailures() {
        return !pageFailures.isEmpty();
    }
}
