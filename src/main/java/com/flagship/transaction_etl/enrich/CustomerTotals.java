package com.flagship.transaction_etl.enrich;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-customer rollup of one run's accepted records.
 */
@Value
public class CustomerTotals {
    long transactionCount;
    BigDecimal totalAmount;

    public static CustomerTotals of(BigDecimal amount) {
        return new CustomerTotals(1, amount);
    }

    public CustomerTotals plus(CustomerTotals other) {
        return new CustomerTotals(transactionCount + other.transactionCount, totalAmount.add(other.totalAmount));
    }
}
