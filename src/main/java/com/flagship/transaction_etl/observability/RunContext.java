package com.flagship.transaction_etl.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and id generation for tracing a pipeline run through the logs.
 *
 * Every log line written while a run is active carries its {@code runId};
 * HTTP-triggered runs also carry the request's {@code correlationId}.
 */
public final class RunContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String RUN_ID_MDC_KEY = "runId";

    private RunContext() {
        // Utility class
    }

    /**
     * Short ids keep log lines readable.
     */
    public static String generateId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Binds a run id to the current thread until the returned scope is closed.
     */
    public static MDC.MDCCloseable openRun(String runId) {
        return MDC.putCloseable(RUN_ID_MDC_KEY, runId);
    }
}
