package com.example.forecastdashboard.dto.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record LatestForecast(@JsonProperty("forecast_qty") int forecastQty,
                             @JsonProperty("forecast_date") LocalDate forecastDate,
                             String model) {

    public static LatestForecast from(ForecastRow row) {
        return new LatestForecast(row.forecastQty(), row.forecastDate(), row.model());
    }
}
