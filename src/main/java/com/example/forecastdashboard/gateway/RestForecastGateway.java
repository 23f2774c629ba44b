package com.example.forecastdashboard.gateway;

import com.example.forecastdashboard.dto.forecast.ForecastColumn;
import com.example.forecastdashboard.dto.forecast.ForecastFilter;
import com.example.forecastdashboard.dto.forecast.ForecastRow;
import com.example.forecastdashboard.exception.ForecastDataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

public class RestForecastGateway implements ForecastGateway {

    private static final Logger log = LoggerFactory.getLogger(RestForecastGateway.class);

    private static final String FORECASTS_PATH = "/rest/v1/forecasts";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public RestForecastGateway(RestTemplate restTemplate, String baseUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public List<ForecastRow> fetchRows(ForecastFilter filter) {
        UriComponentsBuilder builder = forecastsUri()
                .queryParam("select", "*")
                .queryParam("store_id", "eq." + filter.storeId())
                .queryParam("product_id", "eq." + filter.productId())
                .queryParam("order", "forecast_date.asc,model.asc");
        if (filter.startDate() != null) {
            builder.queryParam("forecast_date", "gte." + filter.startDate());
        }
        if (filter.endDate() != null) {
            builder.queryParam("forecast_date", "lte." + filter.endDate());
        }
        return Arrays.stream(exchange(builder.build().encode().toUri()))
                .map(this::toRow)
                .toList();
    }

    @Override
    public List<ForecastRow> fetchAll() {
        URI uri = forecastsUri()
                .queryParam("select", "*")
                .build()
                .encode()
                .toUri();
        return Arrays.stream(exchange(uri))
                .map(this::toRow)
                .toList();
    }

    @Override
    public List<String> fetchDistinct(ForecastColumn column) {
        URI uri = forecastsUri()
                .queryParam("select", column.columnName())
                .build()
                .encode()
                .toUri();
        TreeSet<String> values = new TreeSet<>();
        for (ForecastRecord record : exchange(uri)) {
            if (record == null) {
                throw new ForecastDataSourceException("Data API returned an incomplete forecast row");
            }
            String value = column == ForecastColumn.STORE_ID ? record.storeId() : record.productId();
            if (value != null) {
                values.add(value);
            }
        }
        return List.copyOf(values);
    }

    private UriComponentsBuilder forecastsUri() {
        return UriComponentsBuilder.fromUriString(baseUrl).path(FORECASTS_PATH);
    }

    private ForecastRecord[] exchange(URI uri) {
        log.debug("Querying data API: {}", uri.getRawQuery());
        ResponseEntity<ForecastRecord[]> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()), ForecastRecord[].class);
        } catch (RestClientException ex) {
            throw new ForecastDataSourceException("Data API request failed", ex);
        }
        ForecastRecord[] body = response.getBody();
        if (body == null) {
            throw new ForecastDataSourceException("Data API returned no body");
        }
        return body;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("apikey", apiKey);
        headers.setBearerAuth(apiKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private ForecastRow toRow(ForecastRecord record) {
        if (record == null
                || record.storeId() == null
                || record.productId() == null
                || record.forecastDate() == null
                || record.forecastQty() == null) {
            throw new ForecastDataSourceException("Data API returned an incomplete forecast row");
        }
        if (record.forecastQty().signum() < 0) {
            throw new ForecastDataSourceException("Data API returned a negative forecast quantity");
        }
        return new ForecastRow(
                record.storeId(),
                record.productId(),
                parseDate(record.forecastDate()),
                parseQuantity(record.forecastQty()),
                record.model()
        );
    }

    private int parseQuantity(BigDecimal value) {
        try {
            return value.intValueExact();
        } catch (ArithmeticException ex) {
            throw new ForecastDataSourceException("Data API returned a non-integer forecast_qty: " + value, ex);
        }
    }

    private LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            throw new ForecastDataSourceException("Data API returned a malformed forecast_date", ex);
        }
    }
}
