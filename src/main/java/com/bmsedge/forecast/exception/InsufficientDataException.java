package com.bmsedge.forecast.exception;

public class InsufficientDataException extends ForecastingException {

    public static final String CODE = "INSUFFICIENT_DATA";

    private final int required;
    private final int actual;

    public InsufficientDataException(int required, int actual) {
        super(CODE, "Minimum " + required + " data points required, got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
