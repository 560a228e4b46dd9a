package com.goldprice.common.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VendorCategoryMapperTest {

    @Test
    @DisplayName("known vendors map to their tags, specific names first")
    void knownVendors() {
        assertEquals("antam-retro", VendorCategoryMapper.categoryFor("ANTAM MULIA RETRO"));
        assertEquals("antam", VendorCategoryMapper.categoryFor("Antam"));
        assertEquals("ubs", VendorCategoryMapper.categoryFor("UBS"));
        assertEquals("galeri24", VendorCategoryMapper.categoryFor("GALERI 24"));
        assertEquals("lotus-archi", VendorCategoryMapper.categoryFor("Lotus Archi"));
        assertEquals("dinar-g24", VendorCategoryMapper.categoryFor("DINAR G24"));
        assertEquals("baby-galeri24", VendorCategoryMapper.categoryFor("BABY SERIES"));
    }

    @Test
    @DisplayName("unknown vendor becomes a slug")
    void unknownVendor() {
        assertEquals("emas-perhiasan", VendorCategoryMapper.categoryFor("  Emas Perhiasan! "));
    }

    @Test
    @DisplayName("blank or null → other")
    void blank() {
        assertEquals(VendorCategoryMapper.OTHER, VendorCategoryMapper.categoryFor(null));
        assertEquals(VendorCategoryMapper.OTHER, VendorCategoryMapper.categoryFor("   "));
        assertEquals(VendorCategoryMapper.OTHER, VendorCategoryMapper.categoryFor("!!!"));
    }
}
