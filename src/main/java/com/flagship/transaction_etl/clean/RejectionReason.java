package com.flagship.transaction_etl.clean;

/**
 * Reason codes attached to raw records that the cleaner refuses.
 */
public enum RejectionReason {

    MISSING_REQUIRED_FIELD("missing required field"),
    FIELD_TOO_LONG("field too long"),
    BAD_DATE("bad date"),
    NEGATIVE_AMOUNT("negative amount"),
    INVALID_AMOUNT("non-numeric or out-of-range amount");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
