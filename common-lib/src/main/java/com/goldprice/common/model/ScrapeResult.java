package com.goldprice.common.model;

import java.util.List;

/**
 * Everything a renderer needs for one run: the (category-filtered) records,
 * run metadata and, when requested, per-record deltas in the same order.
 */
public record ScrapeResult(
    List<CanonicalPriceRecord> records,
    ScrapeMeta meta,
    List<PriceWithDelta> deltas
) {

    public ScrapeResult {
        records = List.copyOf(records);
        deltas  = deltas == null ? List.of() : List.copyOf(deltas);
    }

    public ScrapeResult withDeltas(List<PriceWithDelta> computed) {
        return new ScrapeResult(records, meta, computed);
    }

    public boolean hasDeltas() {
        return !deltas.isEmpty();
    }
}
