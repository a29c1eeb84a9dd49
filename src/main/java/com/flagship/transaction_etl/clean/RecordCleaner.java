package com.flagship.transaction_etl.clean;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repairs or rejects raw transaction records.
 *
 * Rules, in order:
 * 1. Required fields (customer_id, product_id, transaction_date, transaction_amount)
 *    must be present and non-blank. Optional fields get sentinel defaults. Text
 *    values longer than their column allows are rejected.
 * 2. transaction_date is normalized to a calendar date; unparseable dates are rejected.
 * 3. Within a batch, records sharing (customer, product, date, amount) are
 *    deduplicated: the first occurrence is kept, later ones are counted and dropped.
 *    The amount part of the identity is the raw numeric value, or the raw text when
 *    it is not a number.
 * 4. Amounts that are non-numeric, negative or beyond DECIMAL(10,2) are rejected;
 *    zero is accepted. The sign is judged before rounding; accepted amounts are
 *    rounded half-up to two fractional digits.
 *
 * Every input record ends up either in the accepted partition (kept or duplicate)
 * or in the rejected partition.
 */
@Component
@Slf4j
public class RecordCleaner {

    public static final String CUSTOMER_ID = "customer_id";
    public static final String PRODUCT_ID = "product_id";
    public static final String PRODUCT_CATEGORY = "product_category";
    public static final String TRANSACTION_DATE = "transaction_date";
    public static final String TRANSACTION_AMOUNT = "transaction_amount";
    public static final String TRANSACTION_TYPE = "transaction_type";
    public static final String SPEND_CATEGORY = "spend_category";

    public static final String UNKNOWN_TRANSACTION_TYPE = "unknown";
    public static final String UNCATEGORIZED = "uncategorized";

    /** Largest value a DECIMAL(10,2) column holds. */
    static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999.99");

    private static final List<String> REQUIRED_FIELDS =
        List.of(CUSTOMER_ID, PRODUCT_ID, TRANSACTION_DATE, TRANSACTION_AMOUNT);

    private static final List<String> REPORTED_FIELDS = List.of(
        CUSTOMER_ID, PRODUCT_ID, PRODUCT_CATEGORY, TRANSACTION_DATE,
        TRANSACTION_AMOUNT, TRANSACTION_TYPE, SPEND_CATEGORY);

    /** Column widths of the tables each text field ends up in. */
    private static final Map<String, Integer> FIELD_LIMITS = Map.of(
        CUSTOMER_ID, 50,
        PRODUCT_ID, 50,
        PRODUCT_CATEGORY, 100,
        TRANSACTION_TYPE, 50,
        SPEND_CATEGORY, 100);

    /**
     * Cleans a batch of raw records.
     *
     * @param rawRecords Records as extracted, in source order
     * @return The accepted/rejected partition of the batch
     */
    public CleaningResult clean(List<Map<String, Object>> rawRecords) {
        if (rawRecords == null || rawRecords.isEmpty()) {
            log.info("No records to clean");
            return CleaningResult.empty();
        }

        logMissingValues(rawRecords);

        List<CleanedRecord> kept = new ArrayList<>();
        List<Rejection> rejections = new ArrayList<>();
        Set<DedupKey> seen = new HashSet<>();
        int duplicates = 0;

        for (int i = 0; i < rawRecords.size(); i++) {
            Map<String, Object> raw = rawRecords.get(i);

            Optional<CleaningOutcome> identityRejection = checkIdentity(raw);
            if (identityRejection.isPresent()) {
                rejections.add(reject(i, identityRejection.get(), raw));
                continue;
            }

            DedupKey key = DedupKey.of(raw);
            if (!seen.add(key)) {
                duplicates++;
                log.debug("Dropped duplicate record #{}: {}", i, key);
                continue;
            }

            CleaningOutcome outcome = checkAmount(raw);
            if (outcome.isAccepted()) {
                kept.add(outcome.getRecord());
            } else {
                rejections.add(reject(i, outcome, raw));
            }
        }

        CleaningResult result = new CleaningResult(List.copyOf(kept), duplicates, List.copyOf(rejections));
        log.info("Cleaning finished: input={}, accepted={}, duplicates={}, rejected={} {}",
            rawRecords.size(), result.acceptedCount(), duplicates,
            result.rejectedCount(), result.rejectedByReason());
        return result;
    }

    /**
     * Validates and normalizes a single raw record.
     * Does not deduplicate; that needs the rest of the batch.
     */
    public CleaningOutcome validate(Map<String, Object> raw) {
        return checkIdentity(raw).orElseGet(() -> checkAmount(raw));
    }

    /**
     * Rules 1 and 2. Empty when the record has a usable identity.
     */
    private Optional<CleaningOutcome> checkIdentity(Map<String, Object> raw) {
        if (raw == null) {
            return Optional.of(CleaningOutcome.rejected(RejectionReason.MISSING_REQUIRED_FIELD, "record is null"));
        }

        for (String field : REQUIRED_FIELDS) {
            if (isBlank(raw.get(field))) {
                return Optional.of(CleaningOutcome.rejected(RejectionReason.MISSING_REQUIRED_FIELD, field));
            }
        }

        for (String field : REPORTED_FIELDS) {
            Integer limit = FIELD_LIMITS.get(field);
            Object value = raw.get(field);
            if (limit != null && !isBlank(value) && text(value).length() > limit) {
                return Optional.of(CleaningOutcome.rejected(RejectionReason.FIELD_TOO_LONG,
                    field + " exceeds " + limit + " characters"));
            }
        }

        Object rawDate = raw.get(TRANSACTION_DATE);
        if (TransactionDateParser.parse(rawDate).isEmpty()) {
            return Optional.of(CleaningOutcome.rejected(RejectionReason.BAD_DATE, String.valueOf(rawDate)));
        }
        return Optional.empty();
    }

    /**
     * Rule 4, on a record that already passed rules 1 and 2.
     */
    private CleaningOutcome checkAmount(Map<String, Object> raw) {
        Object rawAmount = raw.get(TRANSACTION_AMOUNT);
        Optional<BigDecimal> exact = parseExactAmount(rawAmount);
        if (exact.isEmpty()) {
            return CleaningOutcome.rejected(RejectionReason.INVALID_AMOUNT, String.valueOf(rawAmount));
        }
        if (exact.get().signum() < 0) {
            return CleaningOutcome.rejected(RejectionReason.NEGATIVE_AMOUNT, exact.get().toPlainString());
        }

        BigDecimal amount = roundToCents(exact.get());
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            return CleaningOutcome.rejected(RejectionReason.INVALID_AMOUNT,
                exact.get().toPlainString() + " exceeds " + MAX_AMOUNT.toPlainString());
        }

        return CleaningOutcome.accepted(CleanedRecord.builder()
            .customerId(text(raw.get(CUSTOMER_ID)))
            .productId(text(raw.get(PRODUCT_ID)))
            .productCategory(textOrDefault(raw.get(PRODUCT_CATEGORY), UNCATEGORIZED))
            .transactionDate(TransactionDateParser.parse(raw.get(TRANSACTION_DATE)).orElseThrow())
            .transactionAmount(amount)
            .transactionType(textOrDefault(raw.get(TRANSACTION_TYPE), UNKNOWN_TRANSACTION_TYPE))
            .spendCategory(textOrDefault(raw.get(SPEND_CATEGORY), UNCATEGORIZED))
            .build());
    }

    /**
     * The amount as a number, rounded half-up to cents.
     */
    static Optional<BigDecimal> parseAmount(Object value) {
        return parseExactAmount(value).map(RecordCleaner::roundToCents);
    }

    private static Optional<BigDecimal> parseExactAmount(Object value) {
        if (value instanceof Boolean || value == null) {
            return Optional.empty();
        }
        String text = value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString().trim();
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static BigDecimal roundToCents(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static Rejection reject(int index, CleaningOutcome outcome, Map<String, Object> raw) {
        log.debug("Rejected record #{}: {} ({}) {}", index, outcome.getReason(), outcome.getDetail(), raw);
        return new Rejection(index, outcome.getReason(), outcome.getDetail(), raw);
    }

    private void logMissingValues(List<Map<String, Object>> rawRecords) {
        Map<String, Integer> missing = new LinkedHashMap<>();
        for (String field : REPORTED_FIELDS) {
            int count = 0;
            for (Map<String, Object> raw : rawRecords) {
                if (raw == null || isBlank(raw.get(field))) {
                    count++;
                }
            }
            missing.put(field, count);
        }
        log.info("Missing values before cleaning: {}", missing);
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }

    private static String text(Object value) {
        return value.toString().trim();
    }

    private static String textOrDefault(Object value, String defaultValue) {
        return isBlank(value) ? defaultValue : text(value);
    }

    /**
     * Composite identity used for in-batch deduplication. Only built for records
     * that passed rules 1 and 2.
     */
    @Value
    static class DedupKey {
        String customerId;
        String productId;
        LocalDate transactionDate;
        String amount;

        static DedupKey of(Map<String, Object> raw) {
            Object rawAmount = raw.get(TRANSACTION_AMOUNT);
            String amount = parseExactAmount(rawAmount)
                .map(exact -> exact.stripTrailingZeros().toPlainString())
                .orElseGet(() -> text(rawAmount));
            return new DedupKey(
                text(raw.get(CUSTOMER_ID)),
                text(raw.get(PRODUCT_ID)),
                TransactionDateParser.parse(raw.get(TRANSACTION_DATE)).orElseThrow(),
                amount);
        }
    }
}
