package com.flagship.transaction_etl.load;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Maps natural keys to dimension-table keys, creating missing rows.
 *
 * Every method runs inside the caller's transaction (MANDATORY propagation), so
 * rows created here commit or roll back together with the fact rows that need them.
 *
 * Resolution is check-then-insert. The insert uses ON CONFLICT DO NOTHING
 * against the table's uniqueness constraint: a conflict means the row already
 * exists, and the key is re-read instead of failing. A plain failing INSERT
 * would abort the surrounding Postgres transaction and with it the whole batch.
 *
 * Dimension rows are never updated: a product seen again with a different
 * category keeps the category it was created with.
 */
@Service
@Slf4j
public class DimensionResolver {

    private final JdbcTemplate jdbcTemplate;

    public DimensionResolver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return the customer's primary key, which is its natural key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String resolveCustomer(String customerId) {
        int created = jdbcTemplate.update(
            "INSERT INTO customers (customer_id) VALUES (?) ON CONFLICT (customer_id) DO NOTHING",
            customerId
        );
        if (created > 0) {
            log.debug("Created customer {}", customerId);
        }
        return customerId;
    }

    /**
     * @return the product's primary key, which is its natural key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String resolveProduct(String productId, String productCategory) {
        int created = jdbcTemplate.update(
            "INSERT INTO products (product_id, product_category) VALUES (?, ?) ON CONFLICT (product_id) DO NOTHING",
            productId,
            productCategory
        );
        if (created > 0) {
            log.debug("Created product {} in category {}", productId, productCategory);
        }
        return productId;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int resolveSpendCategory(String name) {
        return resolveSurrogate(LookupTable.SPEND_CATEGORY, name);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int resolveTransactionType(String name) {
        return resolveSurrogate(LookupTable.TRANSACTION_TYPE, name);
    }

    /**
     * Amount categories are seeded by migration and never created lazily.
     *
     * @throws DataRetrievalFailureException if no band with that name is seeded
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int resolveAmountCategory(String name) {
        List<Integer> ids = jdbcTemplate.queryForList(
            "SELECT amount_category_id FROM amount_categories WHERE category_name = ? ORDER BY amount_category_id LIMIT 1",
            Integer.class,
            name
        );
        if (ids.isEmpty()) {
            throw new DataRetrievalFailureException("Amount category '" + name + "' is not seeded");
        }
        return ids.get(0);
    }

    private int resolveSurrogate(LookupTable table, String name) {
        List<Integer> existing = jdbcTemplate.queryForList(table.selectSql, Integer.class, name);
        if (!existing.isEmpty()) {
            return existing.get(0);
        }

        List<Integer> inserted = jdbcTemplate.queryForList(table.insertSql, Integer.class, name);
        if (!inserted.isEmpty()) {
            log.debug("Created {} '{}' with id {}", table.tableName, name, inserted.get(0));
            return inserted.get(0);
        }

        // Conflict: the row appeared between the check and the insert
        Integer id = jdbcTemplate.queryForObject(table.selectSql, Integer.class, name);
        if (id == null) {
            throw new DataRetrievalFailureException("No key for " + table.tableName + " '" + name + "' after conflict");
        }
        return id;
    }

    private enum LookupTable {
        SPEND_CATEGORY("spend_categories", "spend_category_id", "spend_category_name"),
        TRANSACTION_TYPE("transaction_types", "transaction_type_id", "transaction_type_name");

        private final String tableName;
        private final String selectSql;
        private final String insertSql;

        LookupTable(String tableName, String idColumn, String nameColumn) {
            this.tableName = tableName;
            this.selectSql = "SELECT " + idColumn + " FROM " + tableName + " WHERE " + nameColumn + " = ?";
            this.insertSql = "INSERT INTO " + tableName + " (" + nameColumn + ") VALUES (?) "
                + "ON CONFLICT (" + nameColumn + ") DO NOTHING RETURNING " + idColumn;
        }
    }
}
