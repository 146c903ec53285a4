package com.bmsedge.forecast.model;

import lombok.Value;

@Value
public class ForecastConfidenceInterval {
    double lower;
    double upper;
    double level;
}
