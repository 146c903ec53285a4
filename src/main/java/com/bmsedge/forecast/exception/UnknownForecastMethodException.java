package com.bmsedge.forecast.exception;

import java.util.Collection;

public class UnknownForecastMethodException extends ForecastingException {

    public static final String CODE = "UNKNOWN_FORECAST_METHOD";

    public UnknownForecastMethodException(String method, Collection<String> available) {
        super(CODE, "Unknown forecasting method '" + method + "'. Available: " + String.join(", ", available));
    }
}
