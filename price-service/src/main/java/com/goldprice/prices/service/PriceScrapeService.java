package com.goldprice.prices.service;

import com.goldprice.common.extract.ExtractorRegistry;
import com.goldprice.common.extract.PriceExtractor;
import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.ExtractionResult;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.ScrapeMeta;
import com.goldprice.common.model.ScrapeResult;
import com.goldprice.common.model.SeriesKey;
import com.goldprice.common.model.StoredSnapshot;
import com.goldprice.common.normalize.PriceNormalizer;
import com.goldprice.common.store.PriceSnapshotRecorder;
import com.goldprice.prices.client.DocumentFetcher;
import com.goldprice.prices.config.SourceEndpoints;
import com.goldprice.prices.diff.SnapshotDiffEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the scrape pipeline for one source:
 * select extractor → fetch → extract → normalize → record (detached) → filter → [diff].
 *
 * <p>The selector is validated before any network call. The snapshot write is
 * handed to {@link PriceSnapshotRecorder} with the unfiltered set and never
 * joins the response; only the delta lookup, whose result is part of the
 * response, is awaited.
 */
@Service
public class PriceScrapeService {

    private static final Logger log = LoggerFactory.getLogger(PriceScrapeService.class);

    public static final int DEFAULT_HISTORY_LIMIT = 30;
    public static final int MAX_HISTORY_LIMIT     = 365;

    private final ExtractorRegistry extractors;
    private final DocumentFetcher documentFetcher;
    private final SourceEndpoints endpoints;
    private final PriceSnapshotRecorder snapshotRecorder;
    private final SnapshotDiffEngine diffEngine;
    private final PriceHistoryService historyService;
    private final Clock clock;

    public PriceScrapeService(ExtractorRegistry extractors,
                              DocumentFetcher documentFetcher,
                              SourceEndpoints endpoints,
                              PriceSnapshotRecorder snapshotRecorder,
                              SnapshotDiffEngine diffEngine,
                              PriceHistoryService historyService,
                              Clock clock) {
        this.extractors       = extractors;
        this.documentFetcher  = documentFetcher;
        this.endpoints        = endpoints;
        this.snapshotRecorder = snapshotRecorder;
        this.diffEngine       = diffEngine;
        this.historyService   = historyService;
        this.clock            = clock;
    }

    /**
     * Scrapes a source and returns its normalized records, optionally narrowed
     * to one category. Deltas are not computed.
     */
    public Mono<ScrapeResult> run(String selector, String categoryFilter) {
        return Mono.defer(() -> {
            PriceSource source = PriceSource.fromSelector(selector);
            PriceExtractor extractor = extractors.forSource(source);
            String url = endpoints.urlFor(source);
            log.info("Scrape started. source={} url={} category={}", source.slug(), url, categoryFilter);

            return documentFetcher.fetch(source, url)
                .publishOn(Schedulers.boundedElastic())
                .map(body -> process(source, url, extractor, body, categoryFilter));
        });
    }

    /**
     * As {@link #run}, then annotates every returned record with its change
     * against the latest prior snapshot of its series.
     */
    public Mono<ScrapeResult> runWithDeltas(String selector, String categoryFilter) {
        return run(selector, categoryFilter)
            .flatMap(result -> diffEngine.computeDeltas(result.records(), historyService)
                .map(result::withDeltas));
    }

    /**
     * Stored observations of one series, newest first. A blank category means the
     * source's default category; the limit is clamped to [1, {@value #MAX_HISTORY_LIMIT}].
     */
    public Flux<StoredSnapshot> history(String selector, String category, BigDecimal weight, Integer limit) {
        return Flux.defer(() -> {
            PriceSource source = PriceSource.fromSelector(selector);
            if (weight == null || weight.signum() <= 0) {
                return Flux.error(new IllegalArgumentException("weight must be a positive number of grams"));
            }
            String resolvedCategory = category == null || category.isBlank() ? source.defaultCategory() : category;
            int resolvedLimit = clampLimit(limit);
            log.info("History requested. source={} category={} weight={} limit={}",
                     source.slug(), resolvedCategory, weight, resolvedLimit);
            return historyService.series(source, resolvedCategory, SeriesKey.normalizeWeight(weight), resolvedLimit);
        });
    }

    public List<PriceSource> supportedSources() {
        return Arrays.asList(PriceSource.values());
    }

    static int clampLimit(Integer limit) {
        if (limit == null) return DEFAULT_HISTORY_LIMIT;
        return Math.max(1, Math.min(MAX_HISTORY_LIMIT, limit));
    }

    private ScrapeResult process(PriceSource source, String url, PriceExtractor extractor,
                                 String body, String categoryFilter) {
        Instant observedAt = clock.instant();
        ExtractionResult extraction = extractor.extract(body);
        List<CanonicalPriceRecord> normalized = PriceNormalizer.normalize(extraction, source, observedAt);

        recordSnapshot(source, normalized);

        List<CanonicalPriceRecord> visible = PriceNormalizer.filterByCategory(normalized, categoryFilter);
        log.info("Scrape complete. source={} rows={} records={} returned={} lastUpdated={}",
                 source.slug(), extraction.fields().size(), normalized.size(), visible.size(),
                 extraction.assertedTimestamp());

        return new ScrapeResult(visible,
            new ScrapeMeta(source, url, extraction.assertedTimestamp(), observedAt),
            List.of());
    }

    private void recordSnapshot(PriceSource source, List<CanonicalPriceRecord> records) {
        if (records.isEmpty()) return;
        try {
            snapshotRecorder.record(records);
        } catch (RuntimeException e) {
            log.warn("Snapshot hand-off failed (non-critical). source={} records={}",
                     source.slug(), records.size(), e);
        }
    }
}
