package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call overrides; {@code null} fields keep the service default.
 */
@Value
@Builder
public class ForecastOverrides {
    String method;
    Integer forecastPeriods;
    Double confidenceLevel;
    Boolean applySeasonality;
    SeasonalFactors seasonalFactors;
    Integer movingAverageWindow;
    Double smoothingAlpha;
    Boolean includeTrend;
    Integer minDataPoints;

    public static ForecastOverrides none() {
        return ForecastOverrides.builder().build();
    }

    public static ForecastOverrides method(String method) {
        return ForecastOverrides.builder().method(method).build();
    }
}
