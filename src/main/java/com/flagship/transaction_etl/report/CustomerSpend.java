package com.flagship.transaction_etl.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CustomerSpend {
    String customerId;
    long transactionCount;
    BigDecimal totalSpend;
    BigDecimal averageTransactionAmount;
}
