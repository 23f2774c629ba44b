package com.example.forecastdashboard.repository;

import com.example.forecastdashboard.entity.ForecastEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ForecastRepository extends JpaRepository<ForecastEntity, Long> {

    List<ForecastEntity> findByStoreIdAndProductIdOrderByForecastDateAscModelAsc(String storeId, String productId);

    List<ForecastEntity> findByStoreIdAndProductIdAndForecastDateBetweenOrderByForecastDateAscModelAsc(
            String storeId, String productId, LocalDate from, LocalDate to);

    List<ForecastEntity> findByStoreIdAndProductIdAndForecastDateGreaterThanEqualOrderByForecastDateAscModelAsc(
            String storeId, String productId, LocalDate from);

    List<ForecastEntity> findByStoreIdAndProductIdAndForecastDateLessThanEqualOrderByForecastDateAscModelAsc(
            String storeId, String productId, LocalDate to);

    @Query("""
            SELECT DISTINCT f.storeId
            FROM ForecastEntity f
            WHERE f.storeId IS NOT NULL
            """)
    List<String> findDistinctStoreIds();

    @Query("""
            SELECT DISTINCT f.productId
            FROM ForecastEntity f
            WHERE f.productId IS NOT NULL
            """)
    List<String> findDistinctProductIds();
}
