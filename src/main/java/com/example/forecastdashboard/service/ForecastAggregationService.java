package com.example.forecastdashboard.service;

import com.example.forecastdashboard.dto.forecast.CriticalSku;
import com.example.forecastdashboard.dto.forecast.ForecastRow;
import com.example.forecastdashboard.dto.forecast.ForecastStats;
import com.example.forecastdashboard.dto.forecast.HistoryPoint;
import com.example.forecastdashboard.dto.forecast.TopSku;
import com.example.forecastdashboard.exception.EmptyForecastSeriesException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ForecastAggregationService {

    private static final int AVERAGE_SCALE = 2;

    public ForecastStats computeStats(List<ForecastRow> rows) {
        requireRows(rows);
        long sum = 0;
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        for (ForecastRow row : rows) {
            int quantity = row.forecastQty();
            sum += quantity;
            max = Math.max(max, quantity);
            min = Math.min(min, quantity);
        }
        double avg = BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(rows.size()), AVERAGE_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
        return new ForecastStats(avg, max, min);
    }

    public ForecastRow latestEntry(List<ForecastRow> rows) {
        requireRows(rows);
        ForecastRow latest = rows.get(0);
        // equal dates: the later row in input order wins
        for (ForecastRow row : rows) {
            if (!row.forecastDate().isBefore(latest.forecastDate())) {
                latest = row;
            }
        }
        return latest;
    }

    public List<HistoryPoint> history(List<ForecastRow> rows) {
        return rows.stream()
                .map(row -> new HistoryPoint(row.forecastDate(), row.forecastQty(), row.model()))
                .toList();
    }

    public List<TopSku> topSkus(List<ForecastRow> allRows, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Top SKU limit must be greater than 0");
        }
        Map<String, Long> totals = new HashMap<>();
        for (ForecastRow row : allRows) {
            totals.merge(row.productId(), (long) row.forecastQty(), Long::sum);
        }
        return totals.entrySet().stream()
                .map(entry -> new TopSku(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingLong(TopSku::totalForecast).reversed()
                        .thenComparing(TopSku::productId))
                .limit(limit)
                .toList();
    }

    public List<CriticalSku> criticalSkus(List<ForecastRow> allRows, int threshold) {
        Map<String, Integer> minimums = new HashMap<>();
        for (ForecastRow row : allRows) {
            minimums.merge(row.productId(), row.forecastQty(), Math::min);
        }
        return minimums.entrySet().stream()
                .filter(entry -> entry.getValue() < threshold)
                .map(entry -> new CriticalSku(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparing(CriticalSku::productId))
                .toList();
    }

    private void requireRows(List<ForecastRow> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new EmptyForecastSeriesException("Cannot summarize an empty forecast series");
        }
    }
}
