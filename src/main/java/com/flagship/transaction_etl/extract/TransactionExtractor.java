package com.flagship.transaction_etl.extract;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pulls all pages of a date window from the transaction source.
 *
 * Pagination:
 * - pages are fetched one at a time, starting at page 1
 * - a page shorter than the page size is the last one
 * - a page that still fails after the retry bound is recorded and skipped;
 *   its records are never partially included
 * - fetching stops after {@code extractor.max-consecutive-failures} failed
 *   pages in a row, or at {@code extractor.max-pages}
 */
@Slf4j
@Service
public class TransactionExtractor {

    private final TransactionApiClient client;
    private final Retry pageFetchRetry;
    private final int pageSize;
    private final int maxPages;
    private final int maxConsecutiveFailures;
    private final LocalDate defaultStartDate;
    private final LocalDate defaultEndDate;

    public TransactionExtractor(
            TransactionApiClient client,
            @Qualifier("pageFetchRetry") Retry pageFetchRetry,
            @Value("${extractor.page-size:500}") int pageSize,
            @Value("${extractor.max-pages:1000}") int maxPages,
            @Value("${extractor.max-consecutive-failures:3}") int maxConsecutiveFailures,
            @Value("${extractor.start-date:2023-01-01}") String defaultStartDate,
            @Value("${extractor.end-date:2023-01-31}") String defaultEndDate) {
        if (pageSize < 1 || maxPages < 1 || maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("page-size, max-pages and max-consecutive-failures must be positive");
        }
        this.client = client;
        this.pageFetchRetry = pageFetchRetry;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.defaultStartDate = LocalDate.parse(defaultStartDate);
        this.defaultEndDate = LocalDate.parse(defaultEndDate);
    }

    /**
     * The window configured under {@code extractor.start-date} / {@code extractor.end-date}.
     */
    public ExtractionRequest defaultRequest() {
        return new ExtractionRequest(defaultStartDate, defaultEndDate);
    }

    public ExtractionResult extract(ExtractionRequest request) {
        log.info("Extracting transactions for window {} (pageSize={})", request, pageSize);

        List<Map<String, Object>> records = new ArrayList<>();
        List<PageFailure> failures = new ArrayList<>();
        int pagesFetched = 0;
        int consecutiveFailures = 0;

        for (int page = 1; page <= maxPages; page++) {
            final int currentPage = page;
            List<Map<String, Object>> pageRecords;
            try {
                pageRecords = Retry.decorateSupplier(pageFetchRetry,
                        () -> client.fetchPage(request, currentPage, pageSize)).get();
            } catch (PageFetchException e) {
                int attempts = pageFetchRetry.getRetryConfig().getMaxAttempts();
                failures.add(new PageFailure(e.getPage(), attempts, e.getMessage()));
                consecutiveFailures++;
                log.error("Skipping page {} after {} attempts: {}", e.getPage(), attempts, e.getMessage());

                if (consecutiveFailures >= maxConsecutiveFailures) {
                    log.error("Stopping extraction after {} consecutive page failures", consecutiveFailures);
                    break;
                }
                continue;
            }

            consecutiveFailures = 0;
            pagesFetched++;
            records.addAll(pageRecords);

            if (pageRecords.size() < pageSize) {
                break;
            }
            if (page == maxPages) {
                log.warn("Reached extractor.max-pages={} with full pages; remaining data was not requested", maxPages);
            }
        }

        log.info("Extraction finished: records={}, pagesFetched={}, pagesFailed={}",
                records.size(), pagesFetched, failures.size());
        return new ExtractionResult(List.copyOf(records), List.copyOf(failures), pagesFetched);
    }
}
