package com.goldprice.prices.render;

import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.PriceWithDelta;
import com.goldprice.common.model.ScrapeMeta;
import com.goldprice.common.model.ScrapeResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a scrape as a single-item RSS 2.0 channel.
 *
 * <p>Page timestamps are free-form text ("28 January 2026 14.02", "5 Mei 2025",
 * "2025-05-05"). They are read as Asia/Jakarta wall-clock time; a missing time of
 * day defaults to 12:00, and unreadable text falls back to the render time.
 */
@Component
public class RssFeedRenderer {

    public static final ZoneId SOURCE_ZONE = ZoneId.of("Asia/Jakarta");

    private static final Locale INDONESIAN = Locale.forLanguageTag("id-ID");

    private static final Pattern DAY_MONTH_YEAR =
        Pattern.compile("(\\d{1,2})\\s+(\\p{L}+)\\s+(\\d{4})(?:\\s+(\\d{1,2})[.:](\\d{2}))?");
    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("januari", 1),  Map.entry("january", 1),
        Map.entry("februari", 2), Map.entry("february", 2),
        Map.entry("maret", 3),    Map.entry("march", 3),
        Map.entry("april", 4),
        Map.entry("mei", 5),      Map.entry("may", 5),
        Map.entry("juni", 6),     Map.entry("june", 6),
        Map.entry("juli", 7),     Map.entry("july", 7),
        Map.entry("agustus", 8),  Map.entry("august", 8),
        Map.entry("september", 9),
        Map.entry("oktober", 10), Map.entry("october", 10),
        Map.entry("november", 11),
        Map.entry("desember", 12), Map.entry("december", 12)
    );

    private final String publicBaseUrl;
    private final Clock clock;

    public RssFeedRenderer(@Value("${scraper.public-base-url:http://localhost:8080}") String publicBaseUrl,
                           Clock clock) {
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
            ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
            : publicBaseUrl;
        this.clock = clock;
    }

    public String render(ScrapeResult result) {
        ScrapeMeta meta = result.meta();
        PriceSource source = meta.source();
        String title = source.title();
        String lastUpdated = meta.lastUpdated();
        String pubDate = formatRfc1123(lastUpdated);
        List<PriceWithDelta> rows = result.hasDeltas()
            ? result.deltas()
            : result.records().stream().map(PriceWithDelta::unchanged).toList();

        StringBuilder lines = new StringBuilder();
        for (PriceWithDelta row : rows) {
            lines.append(priceLine(row, result.hasDeltas())).append('\n');
        }

        String itemTitle = "Update Harga Emas " + title + " - "
            + (lastUpdated != null ? lastUpdated : "Terbaru") + " (" + summary(result.records()) + ")";

        String description = """
            <h3>Harga Emas %s</h3>
            <p><strong>Terakhir Update:</strong> %s</p>
            <p><strong>Scraped At:</strong> %s</p>
            <hr/>
            <pre>
            %s</pre>
            <hr/>
            <p>Source: <a href="%s">%s</a></p>
            """.formatted(title, lastUpdated != null ? lastUpdated : "N/A", meta.scrapedAt(),
                          lines, meta.url(), meta.url());

        return channel(source.slug(), title, meta.url(), pubDate,
            itemTitle, guid(source.slug(), lastUpdated), description);
    }

    /** Well-formed feed carrying one item that describes the failure. */
    public String renderError(String selector, String message) {
        String site = selector == null ? "" : selector.trim();
        String pubDate = ZonedDateTime.now(clock).withZoneSameInstant(SOURCE_ZONE)
            .format(DateTimeFormatter.RFC_1123_DATE_TIME);
        String link = publicBaseUrl + "/prices-all";
        return channel(site, site, link, pubDate,
            "Error: " + message, site + "-error-" + LocalDate.now(clock.withZone(SOURCE_ZONE)),
            "<p>" + escapeXml(message) + "</p>");
    }

    private String channel(String slug, String title, String link, String pubDate,
                           String itemTitle, String guid, String descriptionHtml) {
        String selfLink = publicBaseUrl + "/prices-all/" + slug + "/rss";
        return """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0" xmlns:atom="http://www.w3.org/2005/Atom">
              <channel>
                <title>Harga Emas %1$s</title>
                <link>%2$s</link>
                <description>Update harga emas dari %1$s</description>
                <language>id</language>
                <lastBuildDate>%3$s</lastBuildDate>
                <atom:link href="%4$s" rel="self" type="application/rss+xml"/>
                <item>
                  <title>%5$s</title>
                  <link>%2$s</link>
                  <guid isPermaLink="false">%6$s</guid>
                  <pubDate>%3$s</pubDate>
                  <description><![CDATA[%7$s]]></description>
                </item>
              </channel>
            </rss>
            """.formatted(escapeXml(title), escapeXml(link), pubDate, escapeXml(selfLink),
                          escapeXml(itemTitle), escapeXml(guid), cdataSafe(descriptionHtml));
    }

    private static String priceLine(PriceWithDelta row, boolean withChanges) {
        CanonicalPriceRecord r = row.record();
        StringBuilder line = new StringBuilder()
            .append(r.weight().toPlainString()).append("gram (").append(r.category()).append("): ")
            .append(formatRupiah(r.sellPrice())).append(" (jual)");
        if (withChanges) line.append(' ').append(arrow(row.sellChange()));
        if (r.buyPublished()) {
            line.append(" / ").append(formatRupiah(r.buyPrice())).append(" (beli)");
            if (withChanges) line.append(' ').append(arrow(row.buyChange()));
        }
        return line.toString();
    }

    static String arrow(long change) {
        if (change > 0) return "▲ " + formatRupiah(change);
        if (change < 0) return "▼ " + formatRupiah(-change);
        return "=";
    }

    static String formatRupiah(long amount) {
        return "Rp " + NumberFormat.getNumberInstance(INDONESIAN).format(amount);
    }

    private static String summary(List<CanonicalPriceRecord> records) {
        return records.stream()
            .filter(r -> r.weight().compareTo(BigDecimal.ONE) == 0)
            .findFirst()
            .map(r -> "1g: " + formatRupiah(r.sellPrice()))
            .orElse(records.size() + " items");
    }

    private String guid(String slug, String lastUpdated) {
        String base = lastUpdated != null && !lastUpdated.isBlank()
            ? lastUpdated.replaceAll("[^a-zA-Z0-9]", "-").toLowerCase(Locale.ROOT)
            : LocalDate.now(clock.withZone(SOURCE_ZONE)).toString();
        return slug + "-" + base;
    }

    String formatRfc1123(String publishedAt) {
        ZonedDateTime parsed = parseSourceTime(publishedAt);
        ZonedDateTime at = parsed != null ? parsed : ZonedDateTime.now(clock).withZoneSameInstant(SOURCE_ZONE);
        return at.format(DateTimeFormatter.RFC_1123_DATE_TIME);
    }

    static ZonedDateTime parseSourceTime(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            Matcher m = DAY_MONTH_YEAR.matcher(text);
            if (m.find()) {
                Integer month = MONTHS.get(m.group(2).toLowerCase(Locale.ROOT));
                if (month != null) {
                    int hour   = m.group(4) != null ? Integer.parseInt(m.group(4)) : 12;
                    int minute = m.group(5) != null ? Integer.parseInt(m.group(5)) : 0;
                    return LocalDateTime.of(Integer.parseInt(m.group(3)), month,
                        Integer.parseInt(m.group(1)), hour, minute).atZone(SOURCE_ZONE);
                }
            }
            Matcher iso = ISO_DATE.matcher(text.trim());
            if (iso.find()) {
                return LocalDate.parse(iso.group(1)).atTime(12, 0).atZone(SOURCE_ZONE);
            }
        } catch (DateTimeException e) {
            return null;
        }
        return null;
    }

    static String escapeXml(String text) {
        if (text == null) return "";
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&'  -> out.append("&amp;");
                case '<'  -> out.append("&lt;");
                case '>'  -> out.append("&gt;");
                case '"'  -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default   -> out.append(c);
            }
        }
        return out.toString();
    }

    private static String cdataSafe(String text) {
        return text.replace("]]>", "]]]]><![CDATA[>");
    }
}
