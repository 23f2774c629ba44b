package com.example.forecastdashboard.exception;

public class ForecastDataSourceException extends RuntimeException {

    public ForecastDataSourceException(String message) {
        super(message);
    }

    public ForecastDataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
