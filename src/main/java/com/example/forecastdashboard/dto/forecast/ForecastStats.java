package com.example.forecastdashboard.dto.forecast;

public record ForecastStats(double avg, int max, int min) {
}
