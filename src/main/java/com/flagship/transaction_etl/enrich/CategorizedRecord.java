package com.flagship.transaction_etl.enrich;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A cleaned record with its derived attributes attached; the unit the loader writes.
 */
@Value
@Builder
public class CategorizedRecord {
    String customerId;
    String productId;
    String productCategory;
    LocalDate transactionDate;
    BigDecimal transactionAmount;
    String transactionType;
    String spendCategory;
    String amountCategory;
}
