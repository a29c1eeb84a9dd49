package com.flagship.transaction_etl.load;

import lombok.Value;

/**
 * Result of one loader sub-transaction.
 */
@Value
public class BatchOutcome {
    int index;
    int size;
    boolean committed;
    int inserted;
    String error;

    public static BatchOutcome committed(int index, int size, int inserted) {
        return new BatchOutcome(index, size, true, inserted, null);
    }

    public static BatchOutcome rolledBack(int index, int size, String error) {
        return new BatchOutcome(index, size, false, 0, error);
    }
}
