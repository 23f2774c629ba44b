package com.example.forecastdashboard.dto.dashboard;

import java.time.LocalDate;

public record UserProfile(String name, String email, String role, LocalDate joined) {
}
