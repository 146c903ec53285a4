package com.bmsedge.forecast.model;

public enum ForecastConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
}
