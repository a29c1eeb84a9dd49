package com.flagship.transaction_etl.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline over the configured window on a cron schedule.
 * Enabled with {@code pipeline.schedule.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.schedule", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PipelineScheduler {

    private final PipelineOrchestrator orchestrator;

    @Scheduled(cron = "${pipeline.schedule.cron}")
    public void scheduledRun() {
        log.info("Starting scheduled pipeline run");
        orchestrator.runDefault();
    }
}
