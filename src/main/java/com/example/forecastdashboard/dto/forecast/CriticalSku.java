package com.example.forecastdashboard.dto.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CriticalSku(@JsonProperty("product_id") String productId,
                          @JsonProperty("min_qty") int minQty) {
}
