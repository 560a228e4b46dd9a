package com.goldprice.prices.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One price row of the JSON envelope. Change fields are present only when the
 * caller asked for changes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PriceItemDTO(
    @JsonProperty("weight")     BigDecimal weight,
    @JsonProperty("unit")       String unit,
    @JsonProperty("sell")       long sell,
    @JsonProperty("buy")        long buy,
    @JsonProperty("type")       String type,
    @JsonProperty("sellChange") Long sellChange,
    @JsonProperty("buyChange")  Long buyChange
) {
    public static final String UNIT_GRAM = "gram";
}
