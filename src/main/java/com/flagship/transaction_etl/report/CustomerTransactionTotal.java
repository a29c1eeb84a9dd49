package com.flagship.transaction_etl.report;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Row of the {@code customer_transaction_totals} view.
 */
@Value
public class CustomerTransactionTotal {
    String customerId;
    long totalTransactions;
    BigDecimal totalAmount;
}
