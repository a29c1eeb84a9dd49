package com.flagship.transaction_etl.enrich;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CustomerAggregatorTest {

    private final CustomerAggregator aggregator = new CustomerAggregator();

    private static CategorizedRecord record(String customer, String amount) {
        return CategorizedRecord.builder()
                .customerId(customer)
                .productId("P1")
                .productCategory("uncategorized")
                .transactionDate(LocalDate.of(2024, 1, 5))
                .transactionAmount(new BigDecimal(amount))
                .transactionType("purchase")
                .spendCategory("grocery")
                .amountCategory("low")
                .build();
    }

    @Test
    @DisplayName("Sums count and amount per customer")
    void aggregatesPerCustomer() {
        Map<String, CustomerTotals> totals = aggregator.aggregate(List.of(
                record("C2", "10.00"),
                record("C1", "75.00"),
                record("C2", "5.50")));

        assertEquals(List.of("C1", "C2"), List.copyOf(totals.keySet()));
        assertEquals(new CustomerTotals(1, new BigDecimal("75.00")), totals.get("C1"));
        assertEquals(new CustomerTotals(2, new BigDecimal("15.50")), totals.get("C2"));
    }

    @Test
    @DisplayName("Empty input gives empty totals")
    void emptyInput() {
        assertTrue(aggregator.aggregate(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Top customers are ordered by total spend")
    void topBySpend() {
        Map<String, CustomerTotals> totals = aggregator.aggregate(List.of(
                record("C1", "10.00"),
                record("C2", "300.00"),
                record("C3", "50.00")));

        Map<String, CustomerTotals> top = aggregator.topBySpend(totals, 2);

        assertEquals(List.of("C2", "C3"), List.copyOf(top.keySet()));
    }
}
