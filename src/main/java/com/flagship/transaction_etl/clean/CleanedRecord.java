package com.flagship.transaction_etl.clean;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A raw record that passed validation.
 *
 * Invariants:
 * - All four identity fields are present and non-blank
 * - transactionAmount is non-negative, at most 99999999.99, with exactly two fractional digits
 * - Text fields fit the widths of the columns they are stored in
 * - Optional fields carry their sentinel defaults instead of null
 */
@Value
@Builder
public class CleanedRecord {
    String customerId;
    String productId;
    String productCategory;
    LocalDate transactionDate;
    BigDecimal transactionAmount;
    String transactionType;
    String spendCategory;
}
