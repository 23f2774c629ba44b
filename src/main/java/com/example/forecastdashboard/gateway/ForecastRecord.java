package com.example.forecastdashboard.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastRecord(@JsonProperty("store_id") String storeId,
                             @JsonProperty("product_id") String productId,
                             @JsonProperty("forecast_date") String forecastDate,
                             @JsonProperty("forecast_qty") BigDecimal forecastQty,
                             @JsonProperty("model") String model) {
}
