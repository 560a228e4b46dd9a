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
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Aneka Logam publishes one {@code table.lm-table} per product line, each inside
 * a section whose heading names the line (regular, CertiCard, old edition).
 * Columns: weight, sell, buy.
 */
public class AnekalogamExtractor implements PriceExtractor {

    private static final Logger log = LoggerFactory.getLogger(AnekalogamExtractor.class);

    static final String CATEGORY_DEFAULT   = "antam";
    static final String CATEGORY_CERTICARD = "antam-certicard";
    static final String CATEGORY_OLD       = "antam-old";

    // "Last Updated: 28 January 2026    14.02"
    private static final Pattern UPDATE_NOTE =
        Pattern.compile("(\\d{1,2}\\s+\\w+\\s+\\d{4})\\s*(?:.*?(\\d{1,2}[.:]\\d{2}))?");

    @Override
    public PriceSource source() {
        return PriceSource.ANEKALOGAM;
    }

    @Override
    public ExtractionResult extract(String rawDocument) {
        Document doc = Jsoup.parse(rawDocument == null ? "" : rawDocument);
        List<RawField> fields = new ArrayList<>();

        for (Element table : doc.select("table.lm-table")) {
            String category = classify(table);
            for (Element row : table.select("tbody tr")) {
                Elements cells = row.select("td");
                if (cells.size() < 3) continue;

                String weight = PriceTokens.matchWeight(cells.get(0).text(), false);
                if (weight == null) {
                    log.debug("Skipping row without weight. source=anekalogam cell='{}'", cells.get(0).text());
                    continue;
                }
                fields.add(new RawField(weight, cells.get(1).text(), cells.get(2).text(), category, null));
            }
        }

        String lastUpdated = readUpdateNote(doc);
        log.debug("Extracted rows. source=anekalogam rows={} lastUpdated={}", fields.size(), lastUpdated);
        return new ExtractionResult(fields, lastUpdated);
    }

    static String classify(Element table) {
        Element section = table.closest("section");
        if (section == null) return CATEGORY_DEFAULT;
        Element heading = section.selectFirst("h1, h2, h3");
        String title = heading == null ? "" : heading.text().toLowerCase(Locale.ROOT);

        if (title.contains("certicard") || title.contains("reinvented")) {
            return CATEGORY_CERTICARD;
        }
        if (title.contains("edisi lama") || title.contains("old edition")) {
            return CATEGORY_OLD;
        }
        return CATEGORY_DEFAULT;
    }

    private static String readUpdateNote(Document doc) {
        Element note = doc.selectFirst(".update-note");
        if (note == null) return null;

        Matcher m = UPDATE_NOTE.matcher(note.text().replace('\u00a0', ' '));
        if (m.find()) {
            String date = m.group(1);
            String time = m.group(2);
            return time != null ? date + " " + time : date;
        }

        Element strong = note.selectFirst("strong");
        if (strong != null) {
            String text = strong.text().replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
            if (!text.isEmpty()) return text;
        }
        return null;
    }
}
