package com.example.forecastdashboard.dto.forecast;

import java.time.LocalDate;

public record ForecastFilter(String storeId,
                             String productId,
                             LocalDate startDate,
                             LocalDate endDate) {

    public static ForecastFilter of(String storeId, String productId) {
        return new ForecastFilter(storeId, productId, null, null);
    }
}
