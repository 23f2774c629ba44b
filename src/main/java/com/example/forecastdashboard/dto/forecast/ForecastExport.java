package com.example.forecastdashboard.dto.forecast;

public record ForecastExport(String fileName, byte[] content) {
}
