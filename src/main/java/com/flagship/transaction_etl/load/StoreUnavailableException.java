package com.flagship.transaction_etl.load;

/**
 * The relational store cannot be reached at all. Ends the run.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
