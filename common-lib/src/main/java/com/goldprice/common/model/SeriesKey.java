package com.goldprice.common.model;

import java.math.BigDecimal;

/**
 * Identity of one price series across runs. The published timestamp is
 * deliberately absent: it versions a series, it does not identify it.
 */
public record SeriesKey(PriceSource source, String category, BigDecimal weight) {

    public SeriesKey {
        weight = normalizeWeight(weight);
    }

    /**
     * Canonical form of a gram weight: no trailing zeros and never in exponent
     * notation, so {@code 1}, {@code 1.0} and {@code 1.00} compare equal.
     */
    public static BigDecimal normalizeWeight(BigDecimal weight) {
        if (weight == null) return null;
        BigDecimal stripped = weight.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
