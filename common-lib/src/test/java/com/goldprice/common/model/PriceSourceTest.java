package com.goldprice.common.model;

import com.goldprice.common.exception.UnsupportedSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriceSourceTest {

    @Test
    @DisplayName("selector is trimmed and case-insensitive")
    void lenientSelector() {
        assertEquals(PriceSource.GALERI24, PriceSource.fromSelector(" Galeri24 "));
    }

    @Test
    @DisplayName("unknown selector lists the supported ones")
    void unknownSelector() {
        UnsupportedSourceException e = assertThrows(UnsupportedSourceException.class,
            () -> PriceSource.fromSelector("foo"));
        assertEquals("foo", e.getSelector());
        assertEquals(List.of("anekalogam", "indogold", "pegadaian", "galeri24"), e.getSupportedSelectors());
        assertTrue(e.getMessage().contains("Supported sites: anekalogam, indogold, pegadaian, galeri24"));
    }

    @Test
    @DisplayName("series keys compare weights by value")
    void seriesKeyWeight() {
        assertEquals(new SeriesKey(PriceSource.ANEKALOGAM, "antam", new BigDecimal("1.00")),
                     new SeriesKey(PriceSource.ANEKALOGAM, "antam", BigDecimal.ONE));
    }
}
