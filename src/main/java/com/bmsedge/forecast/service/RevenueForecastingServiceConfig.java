package com.bmsedge.forecast.service;

import com.bmsedge.forecast.model.ForecastMethod;
import com.bmsedge.forecast.service.strategy.ForecastingStrategy;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Construction-time settings of {@link RevenueForecastingService}. {@code strategies}
 * replaces the default strategy set when non-null.
 */
@Value
@Builder
public class RevenueForecastingServiceConfig {
    @Builder.Default
    String defaultMethod = ForecastMethod.ENSEMBLE.key();
    @Builder.Default
    int defaultForecastPeriods = 6;
    @Builder.Default
    double defaultConfidenceLevel = 0.95;
    @Builder.Default
    int defaultMovingAverageWindow = 3;
    @Builder.Default
    double defaultSmoothingAlpha = 0.3;
    @Builder.Default
    boolean defaultApplySeasonality = true;
    @Builder.Default
    boolean defaultIncludeTrend = true;
    @Builder.Default
    int minDataPoints = 6;
    @Builder.Default
    String modelVersion = "2.0.0";
    @Builder.Default
    boolean parallelEnsemble = false;
    List<ForecastingStrategy> strategies;

    public static RevenueForecastingServiceConfig defaults() {
        return RevenueForecastingServiceConfig.builder().build();
    }
}
