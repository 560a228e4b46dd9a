package com.goldprice.prices.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.goldprice.common.model.StoredSnapshot;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceHistoryPointDTO(
    @JsonProperty("weight")      BigDecimal weight,
    @JsonProperty("type")        String type,
    @JsonProperty("sell")        long sell,
    @JsonProperty("buy")         long buy,
    @JsonProperty("publishedAt") String publishedAt,
    @JsonProperty("observedAt")  Instant observedAt
) {

    public static PriceHistoryPointDTO from(StoredSnapshot snapshot) {
        return new PriceHistoryPointDTO(
            snapshot.weight(), snapshot.category(),
            snapshot.sellPrice(), snapshot.buyPrice(),
            snapshot.publishedAt(), snapshot.observedAt()
        );
    }
}
