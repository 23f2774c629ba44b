package com.example.forecastdashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "forecast")
public record ForecastDashboardProperties(@DefaultValue("database") Source source,
                                          @DefaultValue Api api,
                                          @DefaultValue Dashboard dashboard,
                                          @DefaultValue Export export) {

    public enum Source {
        API,
        DATABASE
    }

    public record Api(String baseUrl,
                      String apiKey,
                      @DefaultValue("5s") Duration connectTimeout,
                      @DefaultValue("15s") Duration readTimeout) {
    }

    public record Dashboard(@DefaultValue("10") int topLimit,
                            @DefaultValue("5") int criticalThreshold) {

        public Dashboard {
            if (topLimit <= 0) {
                throw new IllegalArgumentException("forecast.dashboard.top-limit must be greater than 0");
            }
        }
    }

    public record Export(@DefaultValue("false") boolean allowEmpty) {
    }
}
