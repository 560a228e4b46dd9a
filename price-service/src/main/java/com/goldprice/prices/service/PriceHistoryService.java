package com.goldprice.prices.service;

import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.StoredSnapshot;
import com.goldprice.prices.diff.PriorSnapshotLookup;
import com.goldprice.prices.model.PriceHistory;
import com.goldprice.prices.repository.PriceHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Storage and retrieval of price snapshots in {@code gold_price_history}.
 */
@Service
public class PriceHistoryService implements PriorSnapshotLookup {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryService.class);

    // published_at is NOT NULL in the table; "no timestamp" is stored as ""
    static final String NO_TIMESTAMP = "";

    private final PriceHistoryRepository repository;

    public PriceHistoryService(PriceHistoryRepository repository) {
        this.repository = repository;
    }

    /**
     * Writes a run's records. Uses INSERT ON CONFLICT DO NOTHING semantics via
     * the UNIQUE(source, category, weight, published_at) constraint, so
     * re-ingesting an unchanged page is safe.
     *
     * @return number of rows actually inserted
     */
    public Mono<Long> upsert(List<CanonicalPriceRecord> records) {
        if (records == null || records.isEmpty()) return Mono.just(0L);
        log.debug("Upserting snapshot rows. source={} rows={}", records.get(0).source().slug(), records.size());
        return Flux.fromIterable(records)
            .concatMap(r -> repository.insertIgnoringDuplicates(
                r.source().slug(), r.category(), r.weight(),
                r.sellPrice(), r.buyPrice(), r.buyPublished(),
                toStored(r.publishedAt()), r.observedAt()))
            .reduce(0L, (inserted, rows) -> inserted + rows);
    }

    @Override
    public Mono<Map<BigDecimal, StoredSnapshot>> latestBefore(PriceSource source, String category,
                                                              Collection<BigDecimal> weights,
                                                              String excludePublishedAt) {
        if (weights == null || weights.isEmpty()) return Mono.just(Map.of());
        return repository.findLatestBefore(source.slug(), category, List.copyOf(weights), toStored(excludePublishedAt))
            .map(this::toSnapshot)
            .collect(LinkedHashMap<BigDecimal, StoredSnapshot>::new,
                     (byWeight, snapshot) -> byWeight.putIfAbsent(snapshot.weight(), snapshot))
            .map(byWeight -> (Map<BigDecimal, StoredSnapshot>) byWeight)
            .doOnSuccess(byWeight -> log.debug("Prior snapshots loaded. source={} category={} found={}/{}",
                source.slug(), category, byWeight.size(), weights.size()));
    }

    /** Most recent observations of one series, newest first. */
    public Flux<StoredSnapshot> series(PriceSource source, String category, BigDecimal weight, int limit) {
        return repository.findSeries(source.slug(), category, weight, limit)
            .map(this::toSnapshot);
    }

    static String toStored(String publishedAt) {
        return publishedAt == null ? NO_TIMESTAMP : publishedAt;
    }

    private StoredSnapshot toSnapshot(PriceHistory e) {
        String publishedAt = e.getPublishedAt() == null || e.getPublishedAt().isEmpty()
            ? null : e.getPublishedAt();
        return new StoredSnapshot(
            PriceSource.fromSelector(e.getSource()), e.getCategory(), e.getWeight(),
            e.getSellPrice(), e.getBuyPrice(), e.isBuyPublished(),
            publishedAt, e.getObservedAt()
        );
    }
}
