package com.goldprice.prices.repository;

import com.goldprice.prices.model.PriceHistory;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;

@Repository
public interface PriceHistoryRepository extends ReactiveCrudRepository<PriceHistory, Long> {

    /**
     * Idempotent insert keyed on (source, category, weight, published_at).
     * Re-ingesting an unchanged page inserts nothing and raises no error.
     *
     * @return 1 when a row was written, 0 when it already existed
     */
    @Modifying
    @Query("""
        INSERT INTO gold_price_history
            (source, category, weight, sell_price, buy_price, buy_published, published_at, observed_at)
        VALUES
            (:source, :category, :weight, :sellPrice, :buyPrice, :buyPublished, :publishedAt, :observedAt)
        ON CONFLICT (source, category, weight, published_at) DO NOTHING
        """)
    Mono<Integer> insertIgnoringDuplicates(String source, String category, BigDecimal weight,
                                           long sellPrice, long buyPrice, boolean buyPublished,
                                           String publishedAt, Instant observedAt);

    /**
     * Latest row per requested weight, by observed_at, skipping rows that belong
     * to the snapshot identified by {@code excludePublishedAt}.
     */
    @Query("""
        SELECT DISTINCT ON (weight) * FROM gold_price_history
        WHERE source = :source
          AND category = :category
          AND weight IN (:weights)
          AND published_at <> :excludePublishedAt
        ORDER BY weight, observed_at DESC
        """)
    Flux<PriceHistory> findLatestBefore(String source, String category,
                                        Collection<BigDecimal> weights, String excludePublishedAt);

    @Query("""
        SELECT * FROM gold_price_history
        WHERE source = :source
          AND category = :category
          AND weight = :weight
        ORDER BY observed_at DESC
        LIMIT :limit
        """)
    Flux<PriceHistory> findSeries(String source, String category, BigDecimal weight, int limit);
}
