package com.goldprice.common.exception;

/**
 * The origin document could not be retrieved. Never retried.
 */
public class FetchFailureException extends ScrapeException {
    private final String url;

    public FetchFailureException(String selector, String url, Throwable cause) {
        super(selector, "Failed to fetch " + url + ": " + describe(cause), cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
