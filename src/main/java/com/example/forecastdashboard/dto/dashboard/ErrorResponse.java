package com.example.forecastdashboard.dto.dashboard;

public record ErrorResponse(String error) {
}
