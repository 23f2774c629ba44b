package com.example.forecastdashboard.service;

import com.example.forecastdashboard.dto.forecast.CriticalSku;
import com.example.forecastdashboard.dto.forecast.ForecastRow;
import com.example.forecastdashboard.dto.forecast.ForecastStats;
import com.example.forecastdashboard.dto.forecast.HistoryPoint;
import com.example.forecastdashboard.dto.forecast.TopSku;
import com.example.forecastdashboard.exception.EmptyForecastSeriesException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForecastAggregationServiceTest {

    private final ForecastAggregationService aggregationService = new ForecastAggregationService();

    @Test
    void computeStatsOfSingleRowDegeneratesToThatValue() {
        ForecastStats stats = aggregationService.computeStats(List.of(row("A", "2024-01-01", 5)));

        assertThat(stats).isEqualTo(new ForecastStats(5.0, 5, 5));
    }

    @Test
    void computeStatsRejectsEmptySeries() {
        assertThatThrownBy(() -> aggregationService.computeStats(List.of()))
                .isInstanceOf(EmptyForecastSeriesException.class);
    }

    @Test
    @DisplayName("Average is rounded half-up to two decimals")
    void computeStatsRoundsAverageHalfUp() {
        // seven rows of 1 and one row of 2: 9 / 8 = 1.125, half-even would give 1.12
        List<ForecastRow> rows = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            rows.add(row("A", "2024-01-0" + i, 1));
        }
        rows.add(row("A", "2024-01-08", 2));

        ForecastStats stats = aggregationService.computeStats(rows);

        assertThat(stats.avg()).isEqualTo(1.13);
        assertThat(stats.max()).isEqualTo(2);
        assertThat(stats.min()).isEqualTo(1);
    }

    @Test
    void computeStatsRoundsRepeatingAverage() {
        ForecastStats stats = aggregationService.computeStats(List.of(
                row("A", "2024-01-01", 1),
                row("A", "2024-01-02", 1),
                row("A", "2024-01-03", 2)
        ));

        assertThat(stats.avg()).isEqualTo(1.33);
    }

    @Test
    void computeStatsAverageLiesBetweenMinAndMax() {
        Random random = new Random(42);
        for (int attempt = 0; attempt < 50; attempt++) {
            List<ForecastRow> rows = new ArrayList<>();
            int size = 1 + random.nextInt(20);
            for (int i = 0; i < size; i++) {
                rows.add(row("P" + random.nextInt(3), "2024-02-01", random.nextInt(1000)));
            }

            ForecastStats stats = aggregationService.computeStats(rows);

            assertThat(stats.min()).isLessThanOrEqualTo(stats.max());
            assertThat(stats.avg()).isBetween((double) stats.min(), (double) stats.max());
        }
    }

    @Test
    void latestEntryReturnsRowWithGreatestDate() {
        ForecastRow first = row("A", "2024-01-01", 10);
        ForecastRow second = row("A", "2024-01-02", 20);

        assertThat(aggregationService.latestEntry(List.of(first, second))).isSameAs(second);
    }

    @Test
    void latestEntryOfSingleRowIsThatRow() {
        ForecastRow only = row("A", "2024-03-01", 7);

        assertThat(aggregationService.latestEntry(List.of(only))).isSameAs(only);
    }

    @Test
    @DisplayName("Rows sharing the latest date resolve to the last one in input order")
    void latestEntryPrefersLastOfEqualDates() {
        ForecastRow arima = new ForecastRow("S1", "A", LocalDate.parse("2024-01-02"), 4, "arima");
        ForecastRow prophet = new ForecastRow("S1", "A", LocalDate.parse("2024-01-02"), 6, "prophet");

        assertThat(aggregationService.latestEntry(List.of(row("A", "2024-01-01", 1), arima, prophet)))
                .isSameAs(prophet);
    }

    @Test
    void latestEntryRejectsEmptySeries() {
        assertThatThrownBy(() -> aggregationService.latestEntry(List.of()))
                .isInstanceOf(EmptyForecastSeriesException.class);
    }

    @Test
    void historyProjectsRowsInInputOrder() {
        List<HistoryPoint> history = aggregationService.history(List.of(
                row("A", "2024-01-01", 3),
                row("A", "2024-01-02", 9)
        ));

        assertThat(history).containsExactly(
                new HistoryPoint(LocalDate.parse("2024-01-01"), 3, "prophet"),
                new HistoryPoint(LocalDate.parse("2024-01-02"), 9, "prophet")
        );
    }

    @Test
    void topSkusSumsPerProductAndSortsDescending() {
        List<TopSku> top = aggregationService.topSkus(List.of(
                row("A", "2024-01-01", 3),
                row("B", "2024-01-01", 10),
                row("A", "2024-01-02", 5)
        ), 10);

        assertThat(top).containsExactly(new TopSku("B", 10), new TopSku("A", 8));
    }

    @Test
    void topSkusTruncatesToLimitAndBreaksTiesByProductId() {
        List<TopSku> top = aggregationService.topSkus(List.of(
                row("C", "2024-01-01", 4),
                row("B", "2024-01-01", 4),
                row("A", "2024-01-01", 1),
                row("D", "2024-01-01", 9)
        ), 3);

        assertThat(top).containsExactly(new TopSku("D", 9), new TopSku("B", 4), new TopSku("C", 4));
    }

    @Test
    void topSkusOfEmptyDatasetIsEmpty() {
        assertThat(aggregationService.topSkus(List.of(), 10)).isEmpty();
    }

    @Test
    void topSkusRejectsNonPositiveLimit() {
        assertThatThrownBy(() -> aggregationService.topSkus(List.of(row("A", "2024-01-01", 1)), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void criticalSkusKeepsProductsWithMinimumBelowThreshold() {
        List<CriticalSku> critical = aggregationService.criticalSkus(List.of(
                row("A", "2024-01-01", 2),
                row("A", "2024-01-02", 8),
                row("B", "2024-01-01", 6)
        ), 5);

        assertThat(critical).containsExactly(new CriticalSku("A", 2));
    }

    @Test
    @DisplayName("A minimum equal to the threshold is not critical")
    void criticalSkusThresholdIsExclusive() {
        List<CriticalSku> critical = aggregationService.criticalSkus(List.of(
                row("C", "2024-01-01", 0),
                row("A", "2024-01-01", 5),
                row("B", "2024-01-01", 4)
        ), 5);

        assertThat(critical).containsExactly(new CriticalSku("B", 4), new CriticalSku("C", 0));
    }

    @Test
    void aggregationDoesNotModifyInput() {
        List<ForecastRow> rows = List.of(
                row("B", "2024-01-02", 2),
                row("A", "2024-01-01", 9)
        );
        List<ForecastRow> copy = List.copyOf(rows);

        aggregationService.topSkus(rows, 10);
        aggregationService.criticalSkus(rows, 5);
        aggregationService.computeStats(rows);

        assertThat(rows).containsExactlyElementsOf(copy);
    }

    private ForecastRow row(String productId, String date, int quantity) {
        return new ForecastRow("S1", productId, LocalDate.parse(date), quantity, "prophet");
    }
}
