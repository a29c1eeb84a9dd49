package com.flagship.transaction_etl.enrich;

import com.flagship.transaction_etl.clean.CleanedRecord;
import com.flagship.transaction_etl.clean.RecordCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Derives categorical attributes for cleaned records. Pure: never touches the store.
 *
 * - amount_category: the unique band containing the amount
 * - transaction_type, spend_category, product_category: trimmed, internal whitespace
 *   collapsed, lower-cased; blank values fall back to their sentinels so the
 *   lookup tables never receive an empty name
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Categorizer {

    private final AmountBands amountBands;

    public CategorizedRecord categorize(CleanedRecord record) {
        return CategorizedRecord.builder()
            .customerId(record.getCustomerId())
            .productId(record.getProductId())
            .productCategory(normalize(record.getProductCategory(), RecordCleaner.UNCATEGORIZED))
            .transactionDate(record.getTransactionDate())
            .transactionAmount(record.getTransactionAmount())
            .transactionType(normalize(record.getTransactionType(), RecordCleaner.UNKNOWN_TRANSACTION_TYPE))
            .spendCategory(normalize(record.getSpendCategory(), RecordCleaner.UNCATEGORIZED))
            .amountCategory(amountBands.locate(record.getTransactionAmount()).getName())
            .build();
    }

    public List<CategorizedRecord> categorizeAll(List<CleanedRecord> records) {
        List<CategorizedRecord> categorized = records.stream()
            .map(this::categorize)
            .toList();

        if (!categorized.isEmpty()) {
            Map<String, Long> perBand = categorized.stream()
                .collect(Collectors.groupingBy(CategorizedRecord::getAmountCategory, TreeMap::new, Collectors.counting()));
            log.info("Amount categories assigned: {}", perBand);
        }
        return categorized;
    }

    static String normalize(String value, String sentinel) {
        if (value == null || value.isBlank()) {
            return sentinel;
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
