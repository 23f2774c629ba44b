package com.example.forecastdashboard.gateway;

import com.example.forecastdashboard.dto.forecast.ForecastColumn;
import com.example.forecastdashboard.dto.forecast.ForecastFilter;
import com.example.forecastdashboard.dto.forecast.ForecastRow;
import com.example.forecastdashboard.entity.ForecastEntity;
import com.example.forecastdashboard.exception.ForecastDataSourceException;
import com.example.forecastdashboard.repository.ForecastRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.function.Supplier;

public class JpaForecastGateway implements ForecastGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaForecastGateway.class);

    private final ForecastRepository forecastRepository;

    public JpaForecastGateway(ForecastRepository forecastRepository) {
        this.forecastRepository = forecastRepository;
    }

    @Override
    public List<ForecastRow> fetchRows(ForecastFilter filter) {
        log.debug("Loading forecasts for store {} product {} between {} and {}",
                filter.storeId(), filter.productId(), filter.startDate(), filter.endDate());
        List<ForecastEntity> entities = query("forecast rows", () -> findRows(filter));
        return toRows(entities);
    }

    @Override
    public List<ForecastRow> fetchAll() {
        return toRows(query("all forecast rows", () -> forecastRepository.findAll()));
    }

    @Override
    public List<String> fetchDistinct(ForecastColumn column) {
        List<String> values = query("distinct " + column.columnName(), () -> switch (column) {
            case STORE_ID -> forecastRepository.findDistinctStoreIds();
            case PRODUCT_ID -> forecastRepository.findDistinctProductIds();
        });
        // collation-independent, same order as the API gateway
        return values.stream()
                .sorted()
                .toList();
    }

    private List<ForecastEntity> findRows(ForecastFilter filter) {
        String storeId = filter.storeId();
        String productId = filter.productId();
        if (filter.startDate() != null && filter.endDate() != null) {
            return forecastRepository.findByStoreIdAndProductIdAndForecastDateBetweenOrderByForecastDateAscModelAsc(
                    storeId, productId, filter.startDate(), filter.endDate());
        }
        if (filter.startDate() != null) {
            return forecastRepository.findByStoreIdAndProductIdAndForecastDateGreaterThanEqualOrderByForecastDateAscModelAsc(
                    storeId, productId, filter.startDate());
        }
        if (filter.endDate() != null) {
            return forecastRepository.findByStoreIdAndProductIdAndForecastDateLessThanEqualOrderByForecastDateAscModelAsc(
                    storeId, productId, filter.endDate());
        }
        return forecastRepository.findByStoreIdAndProductIdOrderByForecastDateAscModelAsc(storeId, productId);
    }

    private <T> T query(String description, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException ex) {
            throw new ForecastDataSourceException("Database query failed: " + description, ex);
        }
    }

    private List<ForecastRow> toRows(List<ForecastEntity> entities) {
        return entities.stream()
                .map(this::toRow)
                .toList();
    }

    private ForecastRow toRow(ForecastEntity entity) {
        if (entity.getForecastQty() == null || entity.getForecastQty() < 0) {
            throw new ForecastDataSourceException("Stored forecast " + entity.getId() + " has an invalid quantity");
        }
        return new ForecastRow(
                entity.getStoreId(),
                entity.getProductId(),
                entity.getForecastDate(),
                entity.getForecastQty(),
                entity.getModel()
        );
    }
}
