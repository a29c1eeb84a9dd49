package com.flagship.transaction_etl.pipeline;

/**
 * Final state of a pipeline run.
 */
public enum RunStatus {
    /** Every stage finished and nothing was lost. */
    COMPLETED,
    /** Finished, but some pages or batches failed. */
    COMPLETED_WITH_ERRORS,
    /** The store was unreachable or a stage failed unexpectedly. */
    FAILED,
    /** Not started because another run was in progress. */
    SKIPPED
}
