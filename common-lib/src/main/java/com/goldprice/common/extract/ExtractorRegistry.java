package com.goldprice.common.extract;

import com.goldprice.common.exception.UnsupportedSourceException;
import com.goldprice.common.model.PriceSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the extractor for a source. Adding a source means adding a
 * {@link PriceSource} constant and one {@link PriceExtractor}; nothing here changes.
 */
public final class ExtractorRegistry {

    private final Map<PriceSource, PriceExtractor> extractors = new EnumMap<>(PriceSource.class);

    public ExtractorRegistry(List<PriceExtractor> extractors) {
        for (PriceExtractor extractor : extractors) {
            PriceExtractor previous = this.extractors.put(extractor.source(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate extractor for source " + extractor.source().slug());
            }
        }
    }

    public static ExtractorRegistry defaults() {
        return new ExtractorRegistry(List.of(
            new AnekalogamExtractor(),
            new IndogoldExtractor(),
            new PegadaianExtractor(),
            new Galeri24Extractor()
        ));
    }

    public PriceExtractor forSource(PriceSource source) {
        PriceExtractor extractor = extractors.get(source);
        if (extractor == null) {
            throw new UnsupportedSourceException(source.slug(), PriceSource.selectors());
        }
        return extractor;
    }
}
