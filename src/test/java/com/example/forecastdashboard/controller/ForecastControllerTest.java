package com.example.forecastdashboard.controller;

import com.example.forecastdashboard.dto.forecast.ForecastExport;
import com.example.forecastdashboard.exception.EmptyForecastSeriesException;
import com.example.forecastdashboard.exception.ForecastDataSourceException;
import com.example.forecastdashboard.service.ForecastDashboardService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ForecastController.class, DashboardController.class})
class ForecastControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ForecastDashboardService dashboardService;

    @Test
    void dataSourceFailureIsServerErrorWithGenericMessage() throws Exception {
        when(dashboardService.buildForecast(any(), any(), any(), any()))
                .thenThrow(new ForecastDataSourceException("Database query failed: forecast rows",
                        new IllegalStateException("jdbc:postgresql://db:5432/forecasts password=secret")));

        mockMvc.perform(post("/forecast")
                        .param("store_id", "S1")
                        .param("product_id", "P1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("Data source unavailable")))
                .andExpect(content().string(not(containsString("secret"))));
    }

    @Test
    void dashboardDataSourceFailureIsServerError() throws Exception {
        when(dashboardService.loadOptions()).thenThrow(new ForecastDataSourceException("Data API request failed"));

        mockMvc.perform(get("/"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("Data source unavailable")));
    }

    @Test
    void escapedEmptySeriesErrorIsNotReportedAsClientError() throws Exception {
        when(dashboardService.buildForecast(any(), any(), any(), any()))
                .thenThrow(new EmptyForecastSeriesException("Cannot summarize an empty forecast series"));

        mockMvc.perform(post("/forecast")
                        .param("store_id", "S1")
                        .param("product_id", "P1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("Internal error")));
    }

    @Test
    void headerOnlyExportIsServedAsCsv() throws Exception {
        byte[] headerOnly = "forecast_date,store_id,product_id,forecast_qty,model\n".getBytes(StandardCharsets.UTF_8);
        when(dashboardService.exportForecast("S1", "P1"))
                .thenReturn(new ForecastExport("forecast_S1_P1.csv", headerOnly));

        mockMvc.perform(post("/export")
                        .param("store_id", "S1")
                        .param("product_id", "P1"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().bytes(headerOnly));
    }

    @Test
    void nonAsciiExportFileNameIsEncodedForTheHeader() throws Exception {
        when(dashboardService.exportForecast("\u00DC1", "P1"))
                .thenReturn(new ForecastExport("forecast_\u00DC1_P1.csv", new byte[0]));

        mockMvc.perform(post("/export")
                        .param("store_id", "\u00DC1")
                        .param("product_id", "P1"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("filename*=UTF-8''forecast_%C3%9C1_P1.csv")));
    }
}
