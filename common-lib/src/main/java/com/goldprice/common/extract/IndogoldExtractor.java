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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IndoGold lists Antam bars in plain tables. A row has either weight + sell
 * or weight + sell + buy. The page date is the first Indonesian long-form date
 * anywhere in the body text.
 */
public class IndogoldExtractor implements PriceExtractor {

    private static final Logger log = LoggerFactory.getLogger(IndogoldExtractor.class);

    private static final Pattern PAGE_DATE = Pattern.compile(
        "(\\d{1,2}\\s+(?:Januari|Februari|Maret|April|Mei|Juni|Juli|Agustus|September|Oktober|November|Desember)\\s+\\d{4})",
        Pattern.CASE_INSENSITIVE);

    @Override
    public PriceSource source() {
        return PriceSource.INDOGOLD;
    }

    @Override
    public ExtractionResult extract(String rawDocument) {
        Document doc = Jsoup.parse(rawDocument == null ? "" : rawDocument);
        List<RawField> fields = new ArrayList<>();

        for (Element row : doc.select("table tr")) {
            Elements cells = row.select("td");
            if (cells.size() < 2) continue;

            String weight = PriceTokens.matchWeight(cells.get(0).text(), true);
            if (weight == null) continue;

            String sell = cells.get(1).text();
            String buy  = cells.size() >= 3 ? cells.get(2).text() : null;
            fields.add(new RawField(weight, sell, buy, PriceSource.INDOGOLD.defaultCategory(), null));
        }

        String lastUpdated = null;
        if (doc.body() != null) {
            Matcher m = PAGE_DATE.matcher(doc.body().text());
            if (m.find()) lastUpdated = m.group(1);
        }
        log.debug("Extracted rows. source=indogold rows={} lastUpdated={}", fields.size(), lastUpdated);
        return new ExtractionResult(fields, lastUpdated);
    }
}
