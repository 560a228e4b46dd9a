package com.goldprice.common.exception;

/**
 * Base type for failures that abort a scrape run. Carries the source selector
 * the caller asked for, as typed (it may not name a known source).
 */
public class ScrapeException extends RuntimeException {
    private final String selector;

    public ScrapeException(String selector, String message) {
        super("[" + selector + "] " + message);
        this.selector = selector;
    }

    public ScrapeException(String selector, String message, Throwable cause) {
        super("[" + selector + "] " + message, cause);
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }
}
