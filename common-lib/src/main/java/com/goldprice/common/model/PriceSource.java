package com.goldprice.common.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.goldprice.common.exception.UnsupportedSourceException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of sites the platform scrapes. Each constant knows its URL slug,
 * display title, default origin URL and the category used when the page does
 * not distinguish product lines.
 */
public enum PriceSource {
    ANEKALOGAM("anekalogam", "Aneka Logam", "https://www.anekalogam.co.id/id/logam-mulia", "antam"),
    INDOGOLD("indogold", "IndoGold", "https://www.indogold.id/harga-emas-hari-ini", "antam"),
    PEGADAIAN("pegadaian", "Pegadaian", "https://www.pegadaian.co.id/harga", "pegadaian"),
    GALERI24("galeri24", "Galeri 24", "https://galeri24.co.id/harga-emas", "other");

    private final String slug;
    private final String title;
    private final String defaultUrl;
    private final String defaultCategory;

    PriceSource(String slug, String title, String defaultUrl, String defaultCategory) {
        this.slug            = slug;
        this.title           = title;
        this.defaultUrl      = defaultUrl;
        this.defaultCategory = defaultCategory;
    }

    @JsonValue
    public String slug() {
        return slug;
    }

    public String title() {
        return title;
    }

    public String defaultUrl() {
        return defaultUrl;
    }

    public String defaultCategory() {
        return defaultCategory;
    }

    /**
     * Resolves a selector (case-insensitive, surrounding whitespace ignored).
     *
     * @throws UnsupportedSourceException if the selector names no known source
     */
    public static PriceSource fromSelector(String selector) {
        String key = selector == null ? "" : selector.trim().toLowerCase(Locale.ROOT);
        for (PriceSource source : values()) {
            if (source.slug.equals(key)) {
                return source;
            }
        }
        throw new UnsupportedSourceException(selector, selectors());
    }

    public static List<String> selectors() {
        return Arrays.stream(values()).map(PriceSource::slug).toList();
    }
}
