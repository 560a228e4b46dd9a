package com.goldprice.prices.config;

import com.goldprice.common.model.PriceSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Origin URL per source. Defaults come from {@link PriceSource}; entries in
 * {@code scraper.source-urls} (keyed by selector) take precedence, which is how
 * a staging mirror or a local fixture server is wired in.
 */
@Component
public class SourceEndpoints {

    private final Map<String, String> overrides;

    public SourceEndpoints(@Value("#{${scraper.source-urls:{:}}}") Map<String, String> overrides) {
        this.overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public String urlFor(PriceSource source) {
        String override = overrides.get(source.slug());
        return override != null && !override.isBlank() ? override : source.defaultUrl();
    }
}
