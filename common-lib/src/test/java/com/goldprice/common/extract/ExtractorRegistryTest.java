package com.goldprice.common.extract;

import com.goldprice.common.exception.UnsupportedSourceException;
import com.goldprice.common.model.PriceSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtractorRegistryTest {

    @Test
    @DisplayName("defaults cover every source")
    void defaultsCoverAllSources() {
        ExtractorRegistry registry = ExtractorRegistry.defaults();
        for (PriceSource source : PriceSource.values()) {
            assertEquals(source, registry.forSource(source).source());
        }
    }

    @Test
    @DisplayName("two extractors for one source → IllegalStateException")
    void duplicateRejected() {
        assertThrows(IllegalStateException.class, () ->
            new ExtractorRegistry(List.of(new PegadaianExtractor(), new PegadaianExtractor())));
    }

    @Test
    @DisplayName("missing extractor → UnsupportedSourceException")
    void missingExtractor() {
        ExtractorRegistry registry = new ExtractorRegistry(List.of(new PegadaianExtractor()));
        assertThrows(UnsupportedSourceException.class, () -> registry.forSource(PriceSource.GALERI24));
    }
}
