package com.bmsedge.forecast.exception;

public class InvalidRevenueDataException extends ForecastingException {

    public static final String CODE = "INVALID_REVENUE_DATA";

    public InvalidRevenueDataException(String message) {
        super(CODE, message);
    }
}
