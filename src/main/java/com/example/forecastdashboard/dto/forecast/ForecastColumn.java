package com.example.forecastdashboard.dto.forecast;

public enum ForecastColumn {
    STORE_ID("store_id"),
    PRODUCT_ID("product_id");

    private final String columnName;

    ForecastColumn(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }
}
