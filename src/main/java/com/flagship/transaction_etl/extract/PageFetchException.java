package com.flagship.transaction_etl.extract;

/**
 * Transient failure fetching one page from the transaction source
 * (connection error, timeout, non-2xx status, unreadable payload).
 */
public class PageFetchException extends RuntimeException {

    private final int page;

    public PageFetchException(int page, String message, Throwable cause) {
        super(String.format("Page %d: %s", page, message), cause);
        this.page = page;
    }

    public int getPage() {
        return page;
    }
}
