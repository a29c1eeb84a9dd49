package com.flagship.transaction_etl.health;

import com.flagship.transaction_etl.pipeline.RunHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain liveness/readiness endpoint: database reachability plus the last run's status.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final RunHistory runHistory;

    public HealthController(DataSource dataSource, RunHistory runHistory) {
        this.dataSource = dataSource;
        this.runHistory = runHistory;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        runHistory.latest().ifPresent(summary -> response.put("lastRun", Map.of(
                "runId", summary.getRunId(),
                "status", summary.getStatus(),
                "finishedAt", summary.getFinishedAt().toString())));

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
