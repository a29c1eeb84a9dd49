package com.flagship.transaction_etl.report;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only insight queries over the loaded transactions.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InsightReportService {

    private static final String CATEGORY_TOTALS_SQL = """
            SELECT p.product_category,
                   COUNT(*) AS transaction_count,
                   SUM(t.transaction_amount) AS total_amount
            FROM transactions t
            JOIN products p ON t.product_id = p.product_id
            GROUP BY p.product_category
            ORDER BY total_amount DESC, p.product_category
            """;

    private static final String TOP_CUSTOMERS_SQL = """
            SELECT c.customer_id,
                   COUNT(*) AS transaction_count,
                   SUM(t.transaction_amount) AS total_spend,
                   ROUND(AVG(t.transaction_amount), 2) AS avg_transaction_amount
            FROM transactions t
            JOIN customers c ON t.customer_id = c.customer_id
            GROUP BY c.customer_id
            ORDER BY total_spend DESC, c.customer_id
            LIMIT ?
            """;

    private static final String MONTHLY_TRENDS_SQL = """
            WITH monthly_trends AS (
                SELECT DATE_TRUNC('month', t.transaction_date)::date AS month,
                       COUNT(*) AS transaction_count,
                       SUM(t.transaction_amount) AS total_spend,
                       COUNT(DISTINCT t.customer_id) AS unique_customers,
                       ROUND(AVG(t.transaction_amount), 2) AS avg_transaction_amount
                FROM transactions t
                WHERE t.transaction_date >= ?
                GROUP BY DATE_TRUNC('month', t.transaction_date)
            )
            SELECT month,
                   TO_CHAR(month, 'FMMonth YYYY') AS label,
                   transaction_count,
                   total_spend,
                   unique_customers,
                   avg_transaction_amount,
                   ROUND((total_spend - LAG(total_spend) OVER (ORDER BY month))
                         / NULLIF(LAG(total_spend) OVER (ORDER BY month), 0) * 100, 2) AS month_over_month_growth
            FROM monthly_trends
            ORDER BY month DESC
            """;

    private static final String CUSTOMER_TOTALS_SQL = """
            SELECT customer_id, total_transactions, total_amount
            FROM customer_transaction_totals
            ORDER BY total_amount DESC, customer_id
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Transaction count and amount per product category, largest total first.
     */
    public List<CategoryTotal> categoryTotals() {
        return jdbcTemplate.query(CATEGORY_TOTALS_SQL, (rs, rowNum) -> new CategoryTotal(
                rs.getString("product_category"),
                rs.getLong("transaction_count"),
                rs.getBigDecimal("total_amount")));
    }

    /**
     * Customers with the highest total spend.
     */
    public List<CustomerSpend> topCustomers(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        return jdbcTemplate.query(TOP_CUSTOMERS_SQL, (rs, rowNum) -> new CustomerSpend(
                rs.getString("customer_id"),
                rs.getLong("transaction_count"),
                rs.getBigDecimal("total_spend"),
                rs.getBigDecimal("avg_transaction_amount")), limit);
    }

    /**
     * Per-month spend for transactions dated on or after {@code since}, newest month first.
     */
    public List<MonthlyTrend> monthlyTrends(LocalDate since) {
        return jdbcTemplate.query(MONTHLY_TRENDS_SQL, (rs, rowNum) -> new MonthlyTrend(
                rs.getDate("month").toLocalDate(),
                rs.getString("label"),
                rs.getLong("transaction_count"),
                rs.getBigDecimal("total_spend"),
                rs.getLong("unique_customers"),
                rs.getBigDecimal("avg_transaction_amount"),
                rs.getBigDecimal("month_over_month_growth")), Date.valueOf(since));
    }

    public List<CustomerTransactionTotal> customerTotals() {
        return jdbcTemplate.query(CUSTOMER_TOTALS_SQL, (rs, rowNum) -> new CustomerTransactionTotal(
                rs.getString("customer_id"),
                rs.getLong("total_transactions"),
                rs.getBigDecimal("total_amount")));
    }
}
