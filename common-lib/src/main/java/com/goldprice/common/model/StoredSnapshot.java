package com.goldprice.common.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A price point as read back from the snapshot store.
 */
public record StoredSnapshot(
    PriceSource source,
    String category,
    BigDecimal weight,
    long sellPrice,
    long buyPrice,
    boolean buyPublished,
    String publishedAt,
    Instant observedAt
) {

    public StoredSnapshot {
        weight = SeriesKey.normalizeWeight(weight);
    }
}
