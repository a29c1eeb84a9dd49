package com.flagship.transaction_etl.clean;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of validating a single raw record: either a cleaned record or a rejection reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CleaningOutcome {
    CleanedRecord record;
    RejectionReason reason;
    String detail;

    public static CleaningOutcome accepted(CleanedRecord record) {
        return new CleaningOutcome(record, null, null);
    }

    public static CleaningOutcome rejected(RejectionReason reason, String detail) {
        return new CleaningOutcome(null, reason, detail);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
