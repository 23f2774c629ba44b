package com.example.forecastdashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastDashboardApplication.class, args);
    }
}
