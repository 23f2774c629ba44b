package com.example.forecastdashboard.controller;

import com.example.forecastdashboard.dto.dashboard.DashboardOptions;
import com.example.forecastdashboard.dto.dashboard.UserProfile;
import com.example.forecastdashboard.service.ForecastDashboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
public class DashboardController {

    private static final UserProfile DEMO_PROFILE = new UserProfile(
            "John Doe",
            "john.doe@example.com",
            "Inventory Manager",
            LocalDate.of(2023, 1, 15)
    );

    private final ForecastDashboardService dashboardService;

    public DashboardController(ForecastDashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/")
    public ResponseEntity<DashboardOptions> dashboard() {
        return ResponseEntity.ok(dashboardService.loadOptions());
    }

    @GetMapping("/profile")
    public ResponseEntity<UserProfile> profile() {
        return ResponseEntity.ok(DEMO_PROFILE);
    }
}
