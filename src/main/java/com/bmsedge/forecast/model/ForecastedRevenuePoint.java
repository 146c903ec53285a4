package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ForecastedRevenuePoint {
    LocalDate date;
    double predicted;
    ForecastConfidenceInterval confidenceInterval;
    Double seasonalFactor;
    Double trendComponent;
    boolean highUncertainty;
}
