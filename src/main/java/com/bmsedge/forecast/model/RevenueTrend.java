package com.bmsedge.forecast.model;

public enum RevenueTrend {
    GROWING,
    STABLE,
    DECLINING,
    VOLATILE
}
