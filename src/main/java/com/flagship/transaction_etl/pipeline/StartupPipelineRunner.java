package com.flagship.transaction_etl.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One run over the configured window as soon as the application is up.
 */
@Component
@ConditionalOnProperty(name = "pipeline.run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StartupPipelineRunner implements ApplicationRunner {

    private final PipelineOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        RunSummary summary = orchestrator.runDefault();
        log.info("Startup run {} finished with status {}", summary.getRunId(), summary.getStatus());
    }
}
