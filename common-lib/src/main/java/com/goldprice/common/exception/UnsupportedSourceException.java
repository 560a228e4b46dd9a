package com.goldprice.common.exception;

import java.util.List;

/**
 * Raised when a selector does not name a known price source. Always thrown
 * before any network access is attempted.
 */
public class UnsupportedSourceException extends ScrapeException {
    private final List<String> supportedSelectors;

    public UnsupportedSourceException(String selector, List<String> supportedSelectors) {
        super(selector, "Site \"" + selector + "\" is not supported for full price scraping. Supported sites: "
            + String.join(", ", supportedSelectors));
        this.supportedSelectors = List.copyOf(supportedSelectors);
    }

    public List<String> getSupportedSelectors() {
        return supportedSelectors;
    }
}
