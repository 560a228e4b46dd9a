package com.goldprice.prices.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.goldprice.common.model.ScrapeMeta;

import java.util.List;

/**
 * API response record for {@code GET /prices-all/{site}}.
 */
public record PriceEnvelopeDTO(
    @JsonProperty("data") List<PriceItemDTO> data,
    @JsonProperty("meta") ScrapeMeta meta
) {}
