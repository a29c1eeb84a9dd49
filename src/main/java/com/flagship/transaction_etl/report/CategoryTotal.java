package com.flagship.transaction_etl.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CategoryTotal {
    String productCategory;
    long transactionCount;
    BigDecimal totalAmount;
}
