package com.flagship.transaction_etl.observability;

import com.flagship.transaction_etl.pipeline.RunHistory;
import com.flagship.transaction_etl.pipeline.RunSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Custom health indicators for the transaction pipeline.
 */
public class HealthIndicators {

    /**
     * Reports the outcome of the most recent run.
     * A run that lost the store is DOWN; one with page or batch failures is DEGRADED.
     */
    @Component("pipelineHealth")
    public static class PipelineHealthIndicator implements HealthIndicator {

        private final RunHistory runHistory;

        public PipelineHealthIndicator(RunHistory runHistory) {
            this.runHistory = runHistory;
        }

        @Override
        public Health health() {
            Optional<RunSummary> latest = runHistory.latest();
            if (latest.isEmpty()) {
                return Health.unknown()
                        .withDetail("note", "No pipeline run has completed yet")
                        .build();
            }

            RunSummary summary = latest.get();
            Health.Builder builder = switch (summary.getStatus()) {
                case COMPLETED -> Health.up();
                case COMPLETED_WITH_ERRORS -> Health.status("DEGRADED");
                case FAILED -> Health.down();
                case SKIPPED -> Health.unknown();
            };

            return builder
                    .withDetail("runId", summary.getRunId())
                    .withDetail("status", summary.getStatus())
                    .withDetail("finishedAt", summary.getFinishedAt())
                    .withDetail("loaded", summary.getLoaded())
                    .withDetail("errors", summary.getErrors().size())
                    .build();
        }
    }
}
