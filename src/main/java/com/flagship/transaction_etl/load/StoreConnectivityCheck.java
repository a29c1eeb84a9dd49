package com.flagship.transaction_etl.load;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Pre-flight check that the store answers before a run touches the source.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreConnectivityCheck {

    private final JdbcTemplate jdbcTemplate;

    /**
     * @throws StoreUnavailableException if a trivial query cannot be executed
     */
    public void verifyReachable() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            String reason = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
            log.error("Store is unreachable: {}", reason);
            throw new StoreUnavailableException("Cannot reach the relational store: " + reason, e);
        }
    }
}
