package com.example.forecastdashboard.dto.forecast;

import java.time.LocalDate;

public record ForecastRow(String storeId,
                          String productId,
                          LocalDate forecastDate,
                          int forecastQty,
                          String model) {
}
