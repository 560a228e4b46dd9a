package com.goldprice.common.extract;

import com.goldprice.common.model.ExtractionResult;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.RawField;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pegadaian shows a sell price per weight only and no page timestamp.
 */
public class PegadaianExtractor implements PriceExtractor {

    private static final Logger log = LoggerFactory.getLogger(PegadaianExtractor.class);

    @Override
    public PriceSource source() {
        return PriceSource.PEGADAIAN;
    }

    @Override
    public ExtractionResult extract(String rawDocument) {
        Document doc = Jsoup.parse(rawDocument == null ? "" : rawDocument);
        List<RawField> fields = new ArrayList<>();

        for (Element row : doc.select("table tbody tr")) {
            Elements cells = row.select("td");
            if (cells.size() < 2) continue;

            String weight = PriceTokens.matchWeight(cells.get(0).text(), true);
            if (weight == null) continue;

            fields.add(new RawField(weight, cells.get(1).text(), null,
                PriceSource.PEGADAIAN.defaultCategory(), null));
        }

        log.debug("Extracted rows. source=pegadaian rows={}", fields.size());
        return new ExtractionResult(fields, null);
    }
}
