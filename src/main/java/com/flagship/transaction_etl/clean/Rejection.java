package com.flagship.transaction_etl.clean;

import lombok.Value;

import java.util.Map;

/**
 * A raw record the cleaner refused, with the position it had in the extracted stream.
 */
@Value
public class Rejection {
    int index;
    RejectionReason reason;
    String detail;
    Map<String, Object> raw;
}
