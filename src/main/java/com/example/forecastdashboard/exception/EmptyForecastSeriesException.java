package com.example.forecastdashboard.exception;

public class EmptyForecastSeriesException extends RuntimeException {

    public EmptyForecastSeriesException(String message) {
        super(message);
    }
}
