package com.goldprice.common.graph;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a vendor name from the Galeri 24 price list to a category tag.
 * Rules are checked in order and the first substring hit wins, so more
 * specific product names come before the brand they contain.
 */
public final class VendorCategoryMapper {

    public static final String OTHER = "other";

    private static final List<Map.Entry<String, String>> RULES = List.of(
        Map.entry("antam mulia retro", "antam-retro"),
        Map.entry("antam",             "antam"),
        Map.entry("ubs",               "ubs"),
        Map.entry("galeri 24",         "galeri24"),
        Map.entry("galeri24",          "galeri24"),
        Map.entry("lotus",             "lotus-archi"),
        Map.entry("dinar",             "dinar-g24"),
        Map.entry("baby",              "baby-galeri24")
    );

    private VendorCategoryMapper() {}

    public static String categoryFor(String vendorName) {
        if (vendorName == null || vendorName.isBlank()) return OTHER;

        String lower = vendorName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> rule : RULES) {
            if (lower.contains(rule.getKey())) {
                return rule.getValue();
            }
        }
        String slug = lower.replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? OTHER : slug;
    }
}
