package com.flagship.transaction_etl.enrich;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes per-customer transaction count and total spend for a run.
 *
 * The result is reporting-only. It is not written back to any table; the
 * customer_transaction_totals view answers the same question over the whole store.
 */
@Component
@Slf4j
public class CustomerAggregator {

    private static final int LOGGED_TOP_CUSTOMERS = 5;

    /**
     * @return customer id to totals, ordered by customer id; empty for empty input
     */
    public Map<String, CustomerTotals> aggregate(Collection<CategorizedRecord> records) {
        Map<String, CustomerTotals> totals = new TreeMap<>();
        for (CategorizedRecord record : records) {
            totals.merge(record.getCustomerId(), CustomerTotals.of(record.getTransactionAmount()), CustomerTotals::plus);
        }
        if (!totals.isEmpty()) {
            log.info("Customer rollup: {} customers, top by spend: {}", totals.size(), topBySpend(totals, LOGGED_TOP_CUSTOMERS));
        }
        return totals;
    }

    /**
     * The {@code limit} customers with the highest total, highest first.
     */
    public Map<String, CustomerTotals> topBySpend(Map<String, CustomerTotals> totals, int limit) {
        Map<String, CustomerTotals> top = new LinkedHashMap<>();
        totals.entrySet().stream()
            .sorted(Map.Entry.<String, CustomerTotals>comparingByValue(
                Comparator.comparing(CustomerTotals::getTotalAmount)).reversed())
            .limit(limit)
            .forEach(entry -> top.put(entry.getKey(), entry.getValue()));
        return top;
    }
}
