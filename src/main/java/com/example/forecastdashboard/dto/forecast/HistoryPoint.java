package com.example.forecastdashboard.dto.forecast;

import java.time.LocalDate;

public record HistoryPoint(LocalDate date, int qty, String model) {
}
