package com.example.forecastdashboard.config;

import com.example.forecastdashboard.gateway.ForecastGateway;
import com.example.forecastdashboard.gateway.JpaForecastGateway;
import com.example.forecastdashboard.gateway.RestForecastGateway;
import com.example.forecastdashboard.repository.ForecastRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(ForecastDashboardProperties.class)
public class ForecastSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastSourceConfig.class);

    @Bean
    @ConditionalOnProperty(name = "forecast.source", havingValue = "api")
    public ForecastGateway restForecastGateway(RestTemplateBuilder builder, ForecastDashboardProperties properties) {
        ForecastDashboardProperties.Api api = properties.api();
        if (!StringUtils.hasText(api.baseUrl()) || !StringUtils.hasText(api.apiKey())) {
            throw new IllegalStateException(
                    "forecast.api.base-url and forecast.api.api-key are required when forecast.source=api");
        }
        RestTemplate restTemplate = builder
                .setConnectTimeout(api.connectTimeout())
                .setReadTimeout(api.readTimeout())
                .additionalInterceptors(loggingInterceptor())
                .build();
        log.info("Forecasts are read from the data API, connect timeout: {}, read timeout: {}",
                api.connectTimeout(), api.readTimeout());
        return new RestForecastGateway(restTemplate, api.baseUrl(), api.apiKey());
    }

    @Bean
    @ConditionalOnProperty(name = "forecast.source", havingValue = "database", matchIfMissing = true)
    public ForecastGateway jpaForecastGateway(ForecastRepository forecastRepository) {
        log.info("Forecasts are read from the database");
        return new JpaForecastGateway(forecastRepository);
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("Data API {} {} - Status: {} - Duration: {}ms",
                    request.getMethod(),
                    request.getURI().getPath(),
                    response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
