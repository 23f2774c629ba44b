package com.example.forecastdashboard.dto.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ForecastResponse(LatestForecast latest,
                               List<HistoryPoint> history,
                               ForecastStats stats,
                               @JsonProperty("top_skus") List<TopSku> topSkus,
                               @JsonProperty("critical_skus") List<CriticalSku> criticalSkus) {
}
