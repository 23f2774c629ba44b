package com.example.forecastdashboard.service;

import com.example.forecastdashboard.dto.forecast.ForecastRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

@Service
public class CsvExportService {

    static final String[] HEADER = {"forecast_date", "store_id", "product_id", "forecast_qty", "model"};

    private final ObjectWriter rowWriter;

    public CsvExportService() {
        CsvMapper csvMapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
        this.rowWriter = csvMapper.writer();
    }

    public byte[] toCsv(List<ForecastRow> rows) {
        List<String[]> lines = new ArrayList<>(rows.size() + 1);
        lines.add(HEADER);
        for (ForecastRow row : rows) {
            lines.add(new String[]{
                    row.forecastDate().toString(),
                    row.storeId(),
                    row.productId(),
                    Integer.toString(row.forecastQty()),
                    row.model()
            });
        }
        try {
            return rowWriter.writeValueAsBytes(lines);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to write forecast CSV", ex);
        }
    }

    public String exportFileName(String storeId, String productId) {
        return "forecast_" + storeId + "_" + productId + ".csv";
    }
}
