package com.bmsedge.forecast.exception;

/**
 * Base class of the precondition failures raised before any forecast computation starts.
 * Each subclass carries a stable machine-readable code.
 */
public abstract class ForecastingException extends RuntimeException {

    private final String code;

    protected ForecastingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
