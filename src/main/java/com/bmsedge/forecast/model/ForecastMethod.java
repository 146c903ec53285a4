package com.bmsedge.forecast.model;

/**
 * Names of the methods available out of the box. Dispatch works on the string key, so
 * strategies registered later are addressable without being listed here.
 */
public enum ForecastMethod {
    MOVING_AVERAGE("moving_average"),
    EXPONENTIAL_SMOOTHING("exponential_smoothing"),
    LINEAR_REGRESSION("linear_regression"),
    ARIMA("arima"),
    ENSEMBLE("ensemble");

    private final String key;

    ForecastMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
