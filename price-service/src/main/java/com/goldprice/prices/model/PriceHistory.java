package com.goldprice.prices.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One stored price observation in {@code gold_price_history}.
 *
 * <p>{@code publishedAt} is never null in the table: a page without a timestamp is
 * stored as the empty string so the UNIQUE(source, category, weight, published_at)
 * constraint also deduplicates those sources. Such a source therefore keeps one row
 * per weight (its first observation) and never has a prior snapshot to diff against.
 */
@Data
@NoArgsConstructor
@Table("gold_price_history")
public class PriceHistory {

    @Id
    private Long id;

    private String     source;
    private String     category;
    private BigDecimal weight;
    private long       sellPrice;
    private long       buyPrice;
    private boolean    buyPublished;
    private String     publishedAt;
    private Instant    observedAt;
}
