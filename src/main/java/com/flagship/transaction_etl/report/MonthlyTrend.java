package com.flagship.transaction_etl.report;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One calendar month of spend. {@code monthOverMonthGrowth} is a percentage and is
 * null for the earliest month in range or when the previous month's spend is zero.
 */
@Value
public class MonthlyTrend {
    LocalDate month;
    String label;
    long transactionCount;
    BigDecimal totalSpend;
    long uniqueCustomers;
    BigDecimal averageTransactionAmount;
    BigDecimal monthOverMonthGrowth;
}
