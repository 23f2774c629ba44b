package com.example.forecastdashboard.exception;

public class ForecastNotFoundException extends RuntimeException {

    public ForecastNotFoundException(String message) {
        super(message);
    }
}
