package com.example.forecastdashboard.service;

import com.example.forecastdashboard.config.ForecastDashboardProperties;
import com.example.forecastdashboard.dto.dashboard.DashboardOptions;
import com.example.forecastdashboard.dto.forecast.ForecastColumn;
import com.example.forecastdashboard.dto.forecast.ForecastExport;
import com.example.forecastdashboard.dto.forecast.ForecastFilter;
import com.example.forecastdashboard.dto.forecast.ForecastResponse;
import com.example.forecastdashboard.dto.forecast.ForecastRow;
import com.example.forecastdashboard.dto.forecast.LatestForecast;
import com.example.forecastdashboard.exception.ForecastNotFoundException;
import com.example.forecastdashboard.gateway.ForecastGateway;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.List;

@Service
public class ForecastDashboardService {

    private final ForecastGateway forecastGateway;
    private final ForecastAggregationService aggregationService;
    private final CsvExportService csvExportService;
    private final ForecastDashboardProperties properties;

    public ForecastDashboardService(ForecastGateway forecastGateway,
                                    ForecastAggregationService aggregationService,
                                    CsvExportService csvExportService,
                                    ForecastDashboardProperties properties) {
        this.forecastGateway = forecastGateway;
        this.aggregationService = aggregationService;
        this.csvExportService = csvExportService;
        this.properties = properties;
    }

    public DashboardOptions loadOptions() {
        return new DashboardOptions(
                forecastGateway.fetchDistinct(ForecastColumn.STORE_ID),
                forecastGateway.fetchDistinct(ForecastColumn.PRODUCT_ID)
        );
    }

    public ForecastResponse buildForecast(String storeId,
                                          String productId,
                                          LocalDate startDate,
                                          LocalDate endDate) {
        requireIdentifiers(storeId, productId);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start_date must not be after end_date");
        }
        List<ForecastRow> rows = forecastGateway.fetchRows(new ForecastFilter(storeId, productId, startDate, endDate));
        if (rows.isEmpty()) {
            throw new ForecastNotFoundException("No forecast found");
        }
        // top and critical lists always cover the whole table, not the requested series
        List<ForecastRow> allRows = forecastGateway.fetchAll();
        ForecastDashboardProperties.Dashboard dashboard = properties.dashboard();
        return new ForecastResponse(
                LatestForecast.from(aggregationService.latestEntry(rows)),
                aggregationService.history(rows),
                aggregationService.computeStats(rows),
                aggregationService.topSkus(allRows, dashboard.topLimit()),
                aggregationService.criticalSkus(allRows, dashboard.criticalThreshold())
        );
    }

    public ForecastExport exportForecast(String storeId, String productId) {
        requireIdentifiers(storeId, productId);
        List<ForecastRow> rows = forecastGateway.fetchRows(ForecastFilter.of(storeId, productId));
        if (rows.isEmpty() && !properties.export().allowEmpty()) {
            throw new ForecastNotFoundException("No data to export");
        }
        return new ForecastExport(
                csvExportService.exportFileName(storeId, productId),
                csvExportService.toCsv(rows)
        );
    }

    private void requireIdentifiers(String storeId, String productId) {
        if (!StringUtils.hasText(storeId) || !StringUtils.hasText(productId)) {
            throw new IllegalArgumentException("store_id and product_id are required");
        }
    }
}
