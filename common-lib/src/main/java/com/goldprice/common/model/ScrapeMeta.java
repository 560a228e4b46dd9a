package com.goldprice.common.model;

import java.time.Instant;

public record ScrapeMeta(
    PriceSource source,
    String url,
    String lastUpdated,
    Instant scrapedAt
) {}
