package com.goldprice.common.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One observed price point in the canonical shape shared by every source.
 *
 * <p>{@code buyPublished} separates "the source shows no buy price" from
 * "the source shows a buy price of zero"; in both cases {@code buyPrice} is 0.
 */
public record CanonicalPriceRecord(
    PriceSource source,
    String category,
    BigDecimal weight,      // grams
    long sellPrice,
    long buyPrice,
    boolean buyPublished,
    String publishedAt,     // as asserted by the page, free-form; null if absent
    Instant observedAt
) {

    public CanonicalPriceRecord {
        weight = SeriesKey.normalizeWeight(weight);
    }

    public SeriesKey seriesKey() {
        return new SeriesKey(source, category, weight);
    }

    public boolean isValid() {
        return weight != null
            && weight.signum() > 0
            && (sellPrice > 0 || buyPrice > 0);
    }
}
