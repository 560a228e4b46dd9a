package com.goldprice.common.model;

/**
 * A current record annotated with its change against the latest prior
 * snapshot of the same series. Both changes are 0 when no prior exists.
 */
public record PriceWithDelta(
    CanonicalPriceRecord record,
    long sellChange,
    long buyChange
) {

    public static PriceWithDelta unchanged(CanonicalPriceRecord record) {
        return new PriceWithDelta(record, 0L, 0L);
    }
}
