package com.flagship.transaction_etl.load;

import com.flagship.transaction_etl.enrich.AmountBands;
import com.flagship.transaction_etl.enrich.CategorizedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loader tests against a real PostgreSQL schema.
 *
 * These tests try to break batch atomicity:
 * - a failing last record must take the whole batch with it, dimensions included
 * - a failing batch must not affect its neighbours
 * - resolving the same natural key twice must never create a second row
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class TransactionLoaderTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_etl")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    /** A band name the migrations never seed. */
    private static final String UNSEEDED_BAND = "unseeded";

    @Autowired
    private TransactionBatchWriter batchWriter;

    @Autowired
    private DimensionResolver dimensionResolver;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE transactions, customers, products, spend_categories, transaction_types RESTART IDENTITY CASCADE");
    }

    private static CategorizedRecord record(String customer, String product, String amount, String type, String spend) {
        return record(customer, product, amount, type, spend,
                AmountBands.standard().locate(new BigDecimal(amount)).getName());
    }

    private static CategorizedRecord record(String customer, String product, String amount, String type, String spend,
                                            String band) {
        return CategorizedRecord.builder()
                .customerId(customer)
                .productId(product)
                .productCategory("grocery")
                .transactionDate(LocalDate.of(2024, 1, 5))
                .transactionAmount(new BigDecimal(amount))
                .transactionType(type)
                .spendCategory(spend)
                .amountCategory(band)
                .build();
    }

    private int count(String table) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }

    @Nested
    @DisplayName("Batch writes")
    class BatchWrites {

        @Test
        @DisplayName("Facts reference dimension rows created on demand")
        void writesFactsWithDimensions() {
            int inserted = batchWriter.writeBatch(List.of(
                    record("C1", "P1", "75.00", "purchase", "grocery"),
                    record("C1", "P2", "10.00", "refund", "grocery"),
                    record("C2", "P1", "250.00", "purchase", "travel")));

            assertEquals(3, inserted);
            assertEquals(3, count("transactions"));
            assertEquals(2, count("customers"));
            assertEquals(2, count("products"));
            assertEquals(2, count("transaction_types"));
            assertEquals(2, count("spend_categories"));

            String band = jdbcTemplate.queryForObject(
                    "SELECT a.category_name FROM transactions t " +
                    "JOIN amount_categories a ON t.amount_category_id = a.amount_category_id " +
                    "WHERE t.customer_id = 'C1' AND t.product_id = 'P1'", String.class);
            assertEquals("medium", band);
        }

        @Test
        @DisplayName("Existing dimension rows are reused by later batches")
        void reusesExistingDimensions() {
            batchWriter.writeBatch(List.of(record("C1", "P1", "10.00", "purchase", "grocery")));
            batchWriter.writeBatch(List.of(record("C1", "P1", "20.00", "purchase", "grocery")));

            assertEquals(2, count("transactions"));
            assertEquals(1, count("customers"));
            assertEquals(1, count("transaction_types"));
            assertEquals(1, count("spend_categories"));
        }

        @Test
        @DisplayName("A failing last record rolls back the whole batch, dimensions included")
        void failureRollsBackWholeBatch() {
            batchWriter.writeBatch(List.of(record("C0", "P0", "5.00", "purchase", "grocery")));

            List<CategorizedRecord> batch = List.of(
                    record("C1", "P1", "75.00", "purchase", "grocery"),
                    record("C2", "P2", "30.00", "chargeback", "electronics"),
                    record("C3", "P3", "40.00", "purchase", "grocery", UNSEEDED_BAND));

            assertThrows(DataAccessException.class, () -> batchWriter.writeBatch(batch));

            assertEquals(1, count("transactions"), "only the earlier batch survives");
            assertEquals(1, count("customers"));
            assertEquals(1, count("products"));
            assertEquals(0, jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM transaction_types WHERE transaction_type_name = 'chargeback'", Integer.class));
            assertEquals(0, jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM spend_categories WHERE spend_category_name = 'electronics'", Integer.class));
        }

        @Test
        @DisplayName("A failed batch does not affect the batches around it")
        void batchesAreIndependent() {
            TransactionLoader loader = new TransactionLoader(batchWriter, 2);

            LoadReport report = loader.load(List.of(
                    record("C1", "P1", "10.00", "purchase", "grocery"),
                    record("C2", "P1", "20.00", "purchase", "grocery"),
                    record("C3", "P1", "30.00", "purchase", "grocery"),
                    record("C4", "P1", "40.00", "purchase", "grocery", UNSEEDED_BAND),
                    record("C5", "P1", "50.00", "purchase", "grocery")));

            assertEquals(3, report.loadedCount());
            assertEquals(2, report.failedRecordCount());
            assertEquals(List.of(true, false, true),
                    report.getBatches().stream().map(BatchOutcome::isCommitted).toList());
            assertFalse(report.isAborted());

            assertEquals(List.of("C1", "C2", "C5"), jdbcTemplate.queryForList(
                    "SELECT customer_id FROM transactions ORDER BY customer_id", String.class));
            assertEquals(0, jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM customers WHERE customer_id IN ('C3', 'C4')", Integer.class));
        }
    }

    @Nested
    @DisplayName("Dimension resolution")
    class DimensionResolution {

        @Test
        @DisplayName("Resolving a natural key twice in one transaction gives one surrogate key")
        void idempotentWithinTransaction() {
            List<Integer> ids = transactionTemplate.execute(status -> List.of(
                    dimensionResolver.resolveSpendCategory("grocery"),
                    dimensionResolver.resolveSpendCategory("grocery"),
                    dimensionResolver.resolveTransactionType("purchase"),
                    dimensionResolver.resolveTransactionType("purchase")));

            assertEquals(ids.get(0), ids.get(1));
            assertEquals(ids.get(2), ids.get(3));
            assertEquals(1, count("spend_categories"));
            assertEquals(1, count("transaction_types"));
        }

        @Test
        @DisplayName("Customers and products are created once; the first product category wins")
        void naturalKeyDimensions() {
            transactionTemplate.executeWithoutResult(status -> {
                dimensionResolver.resolveCustomer("C1");
                dimensionResolver.resolveCustomer("C1");
                dimensionResolver.resolveProduct("P1", "grocery");
                dimensionResolver.resolveProduct("P1", "electronics");
            });

            assertEquals(1, count("customers"));
            assertEquals("grocery", jdbcTemplate.queryForObject(
                    "SELECT product_category FROM products WHERE product_id = 'P1'", String.class));
        }

        @Test
        @DisplayName("Amount bands are looked up, never created")
        void amountCategoriesAreSeeded() {
            Integer medium = transactionTemplate.execute(status -> dimensionResolver.resolveAmountCategory("medium"));

            assertNotNull(medium);
            assertThrows(DataRetrievalFailureException.class, () -> transactionTemplate.execute(
                    status -> dimensionResolver.resolveAmountCategory("enormous")));
            assertEquals(3, count("amount_categories"));
        }

        @Test
        @DisplayName("Resolution outside a transaction is refused")
        void requiresTransaction() {
            assertThrows(IllegalTransactionStateException.class, () -> dimensionResolver.resolveCustomer("C1"));
        }
    }
}
