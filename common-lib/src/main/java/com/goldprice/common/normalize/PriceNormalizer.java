package com.goldprice.common.normalize;

import com.goldprice.common.extract.PriceTokens;
import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.ExtractionResult;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.RawField;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns extracted rows into canonical records.
 *
 * <p>A record survives only if its weight is positive and at least one of its
 * prices is positive; everything else is dropped without error. Category
 * filtering is a separate step applied after normalization, so callers that
 * persist the full set and return a filtered view see the same records.
 */
public final class PriceNormalizer {

    private PriceNormalizer() {}

    public static List<CanonicalPriceRecord> normalize(ExtractionResult extraction,
                                                       PriceSource source,
                                                       Instant observedAt) {
        List<CanonicalPriceRecord> records = new ArrayList<>();
        for (RawField field : extraction.fields()) {
            CanonicalPriceRecord record = toRecord(field, source, extraction.assertedTimestamp(), observedAt);
            if (record != null && record.isValid()) {
                records.add(record);
            }
        }
        return records;
    }

    /**
     * Keeps records whose category equals {@code category} exactly.
     * A {@code null} or blank filter keeps everything.
     */
    public static List<CanonicalPriceRecord> filterByCategory(List<CanonicalPriceRecord> records,
                                                              String category) {
        if (category == null || category.isBlank()) return records;
        return records.stream()
            .filter(r -> category.equals(r.category()))
            .toList();
    }

    private static CanonicalPriceRecord toRecord(RawField field, PriceSource source,
                                                 String batchTimestamp, Instant observedAt) {
        BigDecimal weight = PriceTokens.parseWeight(field.weightText());
        if (weight == null) return null;

        long sell = PriceTokens.parsePrice(field.sellText());
        boolean buyPublished = field.buyText() != null;
        long buy = buyPublished ? PriceTokens.parsePrice(field.buyText()) : 0L;

        String category = field.category() == null || field.category().isBlank()
            ? source.defaultCategory()
            : field.category();
        // one timestamp per snapshot; a field's own date only stands in when the page asserts none
        String publishedAt = batchTimestamp != null ? batchTimestamp : field.timestampText();

        return new CanonicalPriceRecord(source, category, weight, sell, buy, buyPublished,
            publishedAt, observedAt);
    }
}
