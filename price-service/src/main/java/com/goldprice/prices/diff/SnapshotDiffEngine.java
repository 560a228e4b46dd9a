package com.goldprice.prices.diff;

import com.goldprice.common.diff.DeltaCalculator;
import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.PriceWithDelta;
import com.goldprice.common.model.StoredSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Annotates current records with their change against the latest prior snapshot
 * of the same series (source, category, weight).
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Group records by (source, category, publishedAt); one lookup per group covers every
 *       weight. A normalized run carries one timestamp, so the number of store queries is
 *       bounded by the number of categories.</li>
 *   <li>Each lookup excludes its group's published timestamp: a re-scrape of an
 *       unchanged page is never compared against itself.</li>
 *   <li>Records are matched by normalized weight; unmatched records get zero deltas.</li>
 * </ol>
 *
 * <p>A failed lookup degrades that group to "no prior data" instead of failing the run.
 * Output order equals input order.
 */
@Component
public class SnapshotDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(SnapshotDiffEngine.class);

    public Mono<List<PriceWithDelta>> computeDeltas(List<CanonicalPriceRecord> records,
                                                    PriorSnapshotLookup lookup) {
        if (records == null || records.isEmpty()) return Mono.just(List.of());

        Map<Batch, List<CanonicalPriceRecord>> batches = new LinkedHashMap<>();
        for (CanonicalPriceRecord record : records) {
            Batch batch = new Batch(record.source(), record.category(), record.publishedAt());
            batches.computeIfAbsent(batch, k -> new ArrayList<>()).add(record);
        }

        return Flux.fromIterable(batches.entrySet())
            .concatMap(entry -> priorsFor(entry.getKey(), entry.getValue(), lookup)
                .map(priors -> Map.entry(entry.getKey(), priors)))
            .collect(HashMap<Batch, Map<BigDecimal, StoredSnapshot>>::new,
                     (acc, entry) -> acc.put(entry.getKey(), entry.getValue()))
            .map(priorsByBatch -> records.stream()
                .map(r -> DeltaCalculator.apply(r,
                    priorsByBatch.getOrDefault(new Batch(r.source(), r.category(), r.publishedAt()), Map.of()).get(r.weight())))
                .toList());
    }

    private Mono<Map<BigDecimal, StoredSnapshot>> priorsFor(Batch batch,
                                                            List<CanonicalPriceRecord> group,
                                                            PriorSnapshotLookup lookup) {
        String excludePublishedAt = batch.publishedAt();
        List<BigDecimal> weights = group.stream().map(CanonicalPriceRecord::weight).distinct().toList();

        return Mono.defer(() -> lookup.latestBefore(batch.source(), batch.category(), weights, excludePublishedAt))
            .map(found -> byWeight(found, excludePublishedAt))
            .defaultIfEmpty(Map.of())
            .onErrorResume(e -> {
                log.warn("Prior snapshot lookup failed, deltas default to 0. source={} category={} publishedAt={}",
                         batch.source().slug(), batch.category(), batch.publishedAt(), e);
                return Mono.just(Map.of());
            });
    }

    /**
     * Re-keys by normalized weight and drops any row of the current snapshot a
     * lookup implementation might still have returned.
     */
    private static Map<BigDecimal, StoredSnapshot> byWeight(Map<BigDecimal, StoredSnapshot> found,
                                                            String excludePublishedAt) {
        Map<BigDecimal, StoredSnapshot> result = new HashMap<>();
        for (StoredSnapshot snapshot : found.values()) {
            if (snapshot == null || samePublication(snapshot.publishedAt(), excludePublishedAt)) continue;
            result.merge(snapshot.weight(), snapshot,
                (a, b) -> a.observedAt().isAfter(b.observedAt()) ? a : b);
        }
        return result;
    }

    private static boolean samePublication(String a, String b) {
        return Objects.equals(a == null ? "" : a, b == null ? "" : b);
    }

    private record Batch(PriceSource source, String category, String publishedAt) {}
}
