package com.example.forecastdashboard.dto.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TopSku(@JsonProperty("product_id") String productId,
                     @JsonProperty("total_forecast") long totalForecast) {
}
