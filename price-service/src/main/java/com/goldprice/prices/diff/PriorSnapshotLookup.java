package com.goldprice.prices.diff;

import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.StoredSnapshot;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Batched read of the latest prior snapshot per weight for one
 * (source, category) pair.
 */
@FunctionalInterface
public interface PriorSnapshotLookup {

    /**
     * @param excludePublishedAt the current run's published timestamp; rows carrying
     *                           it belong to the current snapshot and must not be returned
     * @return at most one snapshot per weight, the most recently observed one
     */
    Mono<Map<BigDecimal, StoredSnapshot>> latestBefore(PriceSource source, String category,
                                                       Collection<BigDecimal> weights,
                                                       String excludePublishedAt);
}
