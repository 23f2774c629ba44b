package com.example.forecastdashboard.controller;

import com.example.forecastdashboard.dto.forecast.ForecastExport;
import com.example.forecastdashboard.dto.forecast.ForecastResponse;
import com.example.forecastdashboard.service.ForecastDashboardService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

@RestController
public class ForecastController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ForecastDashboardService dashboardService;

    public ForecastController(ForecastDashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @PostMapping("/forecast")
    public ResponseEntity<ForecastResponse> getForecast(
            @RequestParam(value = "store_id", required = false) String storeId,
            @RequestParam(value = "product_id", required = false) String productId,
            @RequestParam(value = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(dashboardService.buildForecast(storeId, productId, startDate, endDate));
    }

    @PostMapping("/export")
    public ResponseEntity<byte[]> exportCsv(@RequestParam(value = "store_id", required = false) String storeId,
                                            @RequestParam(value = "product_id", required = false) String productId) {
        ForecastExport export = dashboardService.exportForecast(storeId, productId);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, contentDisposition(export.fileName()).toString())
                .body(export.content());
    }

    private ContentDisposition contentDisposition(String fileName) {
        ContentDisposition.Builder builder = ContentDisposition.attachment();
        if (StandardCharsets.US_ASCII.newEncoder().canEncode(fileName)) {
            return builder.filename(fileName).build();
        }
        return builder.filename(fileName, StandardCharsets.UTF_8).build();
    }
}
