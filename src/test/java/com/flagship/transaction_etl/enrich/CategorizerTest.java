package com.flagship.transaction_etl.enrich;

import com.flagship.transaction_etl.clean.CleanedRecord;
import com.flagship.transaction_etl.clean.RecordCleaner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategorizerTest {

    private final Categorizer categorizer = new Categorizer(AmountBands.standard());

    private static CleanedRecord record(String amount, String type, String spendCategory) {
        return CleanedRecord.builder()
                .customerId("C1")
                .productId("P1")
                .productCategory("Home  Goods")
                .transactionDate(LocalDate.of(2024, 1, 5))
                .transactionAmount(new BigDecimal(amount))
                .transactionType(type)
                .spendCategory(spendCategory)
                .build();
    }

    @Test
    @DisplayName("Attaches amount band and normalizes categorical names")
    void categorize() {
        CategorizedRecord categorized = categorizer.categorize(record("75.00", "  Purchase ", "Grocery"));

        assertEquals(AmountBands.MEDIUM, categorized.getAmountCategory());
        assertEquals("purchase", categorized.getTransactionType());
        assertEquals("grocery", categorized.getSpendCategory());
        assertEquals("home goods", categorized.getProductCategory());
        assertEquals(new BigDecimal("75.00"), categorized.getTransactionAmount());
        assertEquals("C1", categorized.getCustomerId());
    }

    @Test
    @DisplayName("Blank names fall back to sentinels")
    void blankNamesFallBack() {
        CategorizedRecord categorized = categorizer.categorize(record("10.00", " ", null));

        assertEquals(RecordCleaner.UNKNOWN_TRANSACTION_TYPE, categorized.getTransactionType());
        assertEquals(RecordCleaner.UNCATEGORIZED, categorized.getSpendCategory());
        assertEquals(AmountBands.LOW, categorized.getAmountCategory());
    }

    @Test
    @DisplayName("Categorizes every record, preserving order")
    void categorizeAll() {
        List<CategorizedRecord> categorized = categorizer.categorizeAll(List.of(
                record("10.00", "purchase", "grocery"),
                record("500.00", "refund", "travel")));

        assertEquals(List.of(AmountBands.LOW, AmountBands.HIGH),
                categorized.stream().map(CategorizedRecord::getAmountCategory).toList());
        assertTrue(categorizer.categorizeAll(List.of()).isEmpty());
    }
}
