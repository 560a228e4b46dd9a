package com.goldprice.common.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.goldprice.common.graph.IndexedGraph;
import com.goldprice.common.graph.VendorCategoryMapper;
import com.goldprice.common.model.ExtractionResult;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.RawField;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Galeri 24 renders prices client-side; the page ships its state as a flattened
 * JSON array in {@code script#__NUXT_DATA__}. The price list lives at
 * {@code root.data.prices.data}, each element pointing at an entry object with
 * {@code denomination}, {@code sellingPrice}, {@code buybackPrice},
 * {@code vendorName} and {@code date}.
 */
public class Galeri24Extractor implements PriceExtractor {

    private static final Logger log = LoggerFactory.getLogger(Galeri24Extractor.class);

    static final List<String> PRICE_LIST_PATH = List.of("data", "prices", "data");

    private final ObjectMapper objectMapper;

    public Galeri24Extractor() {
        this(new ObjectMapper());
    }

    public Galeri24Extractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public PriceSource source() {
        return PriceSource.GALERI24;
    }

    @Override
    public ExtractionResult extract(String rawDocument) {
        Document doc = Jsoup.parse(rawDocument == null ? "" : rawDocument);
        String payload = locatePayload(doc);
        if (payload == null) {
            log.warn("State payload not found. source=galeri24");
            return ExtractionResult.empty();
        }

        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("State payload is not valid JSON. source=galeri24 reason={}", e.getOriginalMessage());
            return ExtractionResult.empty();
        }
        if (!(parsed instanceof ArrayNode store)) {
            log.warn("State payload is not a flat array. source=galeri24");
            return ExtractionResult.empty();
        }

        IndexedGraph graph = new IndexedGraph(store);
        JsonNode priceList = graph.path(graph.root(), PRICE_LIST_PATH);
        if (priceList == null || !priceList.isArray()) {
            log.warn("Price list not found in state payload. source=galeri24 entries={}", graph.size());
            return ExtractionResult.empty();
        }

        List<RawField> fields = new ArrayList<>();
        String batchTimestamp = null;
        for (JsonNode reference : priceList) {
            RawField field = readEntry(graph, graph.resolve(reference));
            if (field == null) {
                log.debug("Skipping unreadable price entry. source=galeri24 ref={}", reference);
                continue;
            }
            if (batchTimestamp == null) batchTimestamp = field.timestampText();
            fields.add(field);
        }

        log.debug("Extracted entries. source=galeri24 entries={} lastUpdated={}", fields.size(), batchTimestamp);
        return new ExtractionResult(fields, batchTimestamp);
    }

    private static RawField readEntry(IndexedGraph graph, JsonNode entry) {
        if (entry == null || !entry.isObject()) return null;

        BigDecimal denomination = IndexedGraph.decimal(graph.field(entry, "denomination"));
        if (denomination == null || denomination.signum() <= 0) return null;

        String sell = priceText(graph.field(entry, "sellingPrice"));
        String buy  = priceText(graph.field(entry, "buybackPrice"));
        if (sell == null && buy == null) return null;

        String vendor = IndexedGraph.text(graph.field(entry, "vendorName"));
        String date   = IndexedGraph.text(graph.field(entry, "date"));

        return new RawField(denomination.toPlainString(), sell, buy,
            VendorCategoryMapper.categoryFor(vendor), date);
    }

    private static String priceText(JsonNode node) {
        if (node == null) return null;
        if (node.isNumber()) return node.decimalValue().toBigInteger().toString();
        return IndexedGraph.text(node);
    }

    private static String locatePayload(Document doc) {
        Element nuxt = doc.selectFirst("script#__NUXT_DATA__");
        if (nuxt != null && !nuxt.data().isBlank()) {
            return nuxt.data().trim();
        }
        for (Element script : doc.select("script[type=application/json]")) {
            String data = script.data().trim();
            if (data.startsWith("[")) return data;
        }
        return null;
    }
}
