package com.goldprice.common.extract;

import com.goldprice.common.model.ExtractionResult;
import com.goldprice.common.model.RawField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndogoldExtractorTest {

    private final IndogoldExtractor extractor = new IndogoldExtractor();

    @Test
    @DisplayName("three-cell rows carry buy, two-cell rows publish sell only")
    void rowShapes() {
        String page = """
            <html><body>
            <p>Harga emas hari ini, 5 Mei 2025</p>
            <table>
              <tr><th>Berat</th><th>Jual</th><th>Beli</th></tr>
              <tr><td>1 gram</td><td>Rp 1.950.000</td><td>Rp 1.800.000</td></tr>
              <tr><td>0,5 gram</td><td>Rp 1.010.000</td></tr>
              <tr><td>Antam</td><td>-</td></tr>
            </table>
            </body></html>
            """;

        ExtractionResult result = extractor.extract(page);

        assertEquals(2, result.fields().size());
        assertEquals(new RawField("1 gram", "Rp 1.950.000", "Rp 1.800.000", "antam", null), result.fields().get(0));
        assertNull(result.fields().get(1).buyText());
        assertEquals("5 Mei 2025", result.assertedTimestamp());
    }

    @Test
    @DisplayName("no Indonesian date in body → no timestamp")
    void noDate() {
        ExtractionResult result = extractor.extract(
            "<table><tr><td>1 gram</td><td>Rp 1</td></tr></table>");
        assertNull(result.assertedTimestamp());
        assertEquals(1, result.fields().size());
    }
}
