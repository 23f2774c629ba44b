package com.example.forecastdashboard.dto.dashboard;

import java.util.List;

public record DashboardOptions(List<String> stores, List<String> products) {
}
