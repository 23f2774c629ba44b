package com.example.forecastdashboard.gateway;

import com.example.forecastdashboard.dto.forecast.ForecastColumn;
import com.example.forecastdashboard.dto.forecast.ForecastFilter;
import com.example.forecastdashboard.dto.forecast.ForecastRow;
import com.example.forecastdashboard.exception.ForecastDataSourceException;

import java.util.List;

public interface ForecastGateway {

    List<ForecastRow> fetchRows(ForecastFilter filter);

    List<ForecastRow> fetchAll();

    List<String> fetchDistinct(ForecastColumn column);
}
