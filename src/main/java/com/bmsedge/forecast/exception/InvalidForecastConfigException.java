package com.bmsedge.forecast.exception;

public class InvalidForecastConfigException extends ForecastingException {

    public static final String CODE = "INVALID_FORECAST_CONFIG";

    public InvalidForecastConfigException(String message) {
        super(CODE, message);
    }
}
