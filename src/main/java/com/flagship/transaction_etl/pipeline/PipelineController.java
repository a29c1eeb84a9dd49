package com.flagship.transaction_etl.pipeline;

import com.flagship.transaction_etl.extract.ExtractionRequest;
import com.flagship.transaction_etl.extract.TransactionExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Operator endpoints for triggering runs and reading their summaries.
 */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    private final PipelineOrchestrator orchestrator;
    private final TransactionExtractor extractor;
    private final RunHistory runHistory;

    /**
     * Runs the pipeline synchronously. Missing dates fall back to the configured window.
     *
     * @throws IllegalStateException if a run is already in progress (mapped to 409)
     */
    @PostMapping("/runs")
    public ResponseEntity<RunSummary> triggerRun(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        ExtractionRequest defaults = extractor.defaultRequest();
        ExtractionRequest request = new ExtractionRequest(
                startDate != null ? startDate : defaults.getStartDate(),
                endDate != null ? endDate : defaults.getEndDate());

        log.info("Pipeline run requested for {}", request);
        RunSummary summary = orchestrator.run(request);
        if (summary.getStatus() == RunStatus.SKIPPED) {
            throw new IllegalStateException("A pipeline run is already in progress");
        }
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/runs")
    public List<RunSummary> recentRuns() {
        return runHistory.recent();
    }

    @GetMapping("/runs/latest")
    public ResponseEntity<RunSummary> latestRun() {
        return runHistory.latest()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
