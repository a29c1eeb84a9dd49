package com.flagship.transaction_etl.extract;

import lombok.Value;

/**
 * A page that could not be fetched within the retry bound and was skipped.
 */
@Value
public class PageFailure {
    int page;
    int attempts;
    String message;
}
