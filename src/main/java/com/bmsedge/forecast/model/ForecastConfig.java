package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * Effective settings of one forecast call, merged from service defaults and per-call
 * overrides.
 */
@Value
@Builder(toBuilder = true)
public class ForecastConfig {
    String method;
    ForecastGranularity granularity;
    int forecastPeriods;
    double confidenceLevel;
    boolean applySeasonality;
    SeasonalFactors seasonalFactors;
    int movingAverageWindow;
    double smoothingAlpha;
    boolean includeTrend;
    int minDataPoints;

    /**
     * Applies every non-null field of {@code overrides} on top of this config.
     */
    public ForecastConfig merge(ForecastOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        ForecastConfigBuilder builder = toBuilder();
        if (overrides.getMethod() != null) builder.method(overrides.getMethod());
        if (overrides.getForecastPeriods() != null) builder.forecastPeriods(overrides.getForecastPeriods());
        if (overrides.getConfidenceLevel() != null) builder.confidenceLevel(overrides.getConfidenceLevel());
        if (overrides.getApplySeasonality() != null) builder.applySeasonality(overrides.getApplySeasonality());
        if (overrides.getSeasonalFactors() != null) builder.seasonalFactors(overrides.getSeasonalFactors());
        if (overrides.getMovingAverageWindow() != null) builder.movingAverageWindow(overrides.getMovingAverageWindow());
        if (overrides.getSmoothingAlpha() != null) builder.smoothingAlpha(overrides.getSmoothingAlpha());
        if (overrides.getIncludeTrend() != null) builder.includeTrend(overrides.getIncludeTrend());
        if (overrides.getMinDataPoints() != null) builder.minDataPoints(overrides.getMinDataPoints());
        return builder.build();
    }
}
