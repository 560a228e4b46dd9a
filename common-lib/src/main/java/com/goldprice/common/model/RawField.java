package com.goldprice.common.model;

/**
 * One unvalidated price row as lifted from a source document.
 *
 * @param weightText    weight token, e.g. {@code "0,5 gram"}
 * @param sellText      sell price cell text; {@code null} when the row has no sell cell
 * @param buyText       buy price cell text; {@code null} when the source publishes no buy price
 * @param category      product-line label, or {@code null} for the source default
 * @param timestampText per-row timestamp, or {@code null} to inherit the batch timestamp
 */
public record RawField(
    String weightText,
    String sellText,
    String buyText,
    String category,
    String timestampText
) {}
