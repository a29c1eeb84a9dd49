package com.flagship.transaction_etl.load;

import com.flagship.transaction_etl.enrich.CategorizedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes one batch of categorized records in a single transaction.
 *
 * Steps:
 * 1. Resolve (and create if missing) all five dimension keys of every record
 * 2. Bulk-insert the fact rows with one JDBC batch
 * 3. Commit when the method returns
 *
 * Any exception rolls the whole transaction back: neither the fact rows nor
 * the dimension rows created for this batch survive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionBatchWriter {

    private static final String INSERT_TRANSACTION_SQL =
        "INSERT INTO transactions (customer_id, product_id, transaction_date, transaction_amount, " +
        "transaction_type_id, spend_category_id, amount_category_id) VALUES (?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final DimensionResolver dimensionResolver;

    /**
     * @return number of fact rows inserted
     */
    @Transactional
    public int writeBatch(List<CategorizedRecord> records) {
        DimensionKeys keys = new DimensionKeys();

        List<Object[]> rows = new ArrayList<>(records.size());
        for (CategorizedRecord record : records) {
            rows.add(new Object[] {
                keys.customer(record.getCustomerId()),
                keys.product(record.getProductId(), record.getProductCategory()),
                Date.valueOf(record.getTransactionDate()),
                record.getTransactionAmount(),
                keys.transactionType(record.getTransactionType()),
                keys.spendCategory(record.getSpendCategory()),
                keys.amountCategory(record.getAmountCategory())
            });
        }
        log.debug("Resolved dimensions for {} records: {}", records.size(), keys);

        int[] counts = jdbcTemplate.batchUpdate(INSERT_TRANSACTION_SQL, rows);
        int inserted = 0;
        for (int count : counts) {
            // the driver may report success without a row count
            inserted += count == Statement.SUCCESS_NO_INFO ? 1 : count;
        }
        return inserted;
    }

    /**
     * Keys already resolved in the current transaction. Lives only as long as
     * one batch, so a rolled-back batch never leaks keys into the next one.
     */
    private final class DimensionKeys {
        private final Set<String> customers = new HashSet<>();
        private final Set<String> products = new HashSet<>();
        private final Map<String, Integer> transactionTypes = new HashMap<>();
        private final Map<String, Integer> spendCategories = new HashMap<>();
        private final Map<String, Integer> amountCategories = new HashMap<>();

        String customer(String customerId) {
            if (customers.add(customerId)) {
                dimensionResolver.resolveCustomer(customerId);
            }
            return customerId;
        }

        String product(String productId, String productCategory) {
            if (products.add(productId)) {
                dimensionResolver.resolveProduct(productId, productCategory);
            }
            return productId;
        }

        int transactionType(String name) {
            return transactionTypes.computeIfAbsent(name, dimensionResolver::resolveTransactionType);
        }

        int spendCategory(String name) {
            return spendCategories.computeIfAbsent(name, dimensionResolver::resolveSpendCategory);
        }

        int amountCategory(String name) {
            return amountCategories.computeIfAbsent(name, dimensionResolver::resolveAmountCategory);
        }

        @Override
        public String toString() {
            return String.format("customers=%d, products=%d, transactionTypes=%d, spendCategories=%d, amountCategories=%d",
                customers.size(), products.size(), transactionTypes.size(), spendCategories.size(), amountCategories.size());
        }
    }
}
