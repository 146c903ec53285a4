package com.bmsedge.forecast.dto;

import com.bmsedge.forecast.model.ForecastOverrides;
import com.bmsedge.forecast.model.SeasonalFactors;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;

import java.time.Month;
import java.util.Map;

/**
 * Optional per-request forecast settings. Unset fields fall back to the configured defaults.
 */
@Setter
@Getter
public class ForecastOptionsRequest {

    private String method;

    @Min(value = 1, message = "Forecast periods must be at least 1")
    @Max(value = 60, message = "Forecast periods cannot exceed 60")
    private Integer forecastPeriods;

    @DecimalMin(value = "0.5", message = "Confidence level must be at least 0.5")
    @DecimalMax(value = "0.99", message = "Confidence level cannot exceed 0.99")
    private Double confidenceLevel;

    private Boolean applySeasonality;

    private Map<Month, Double> seasonalFactors;

    @Min(value = 1, message = "Moving average window must be at least 1")
    private Integer movingAverageWindow;

    @DecimalMin(value = "0.01", message = "Smoothing alpha must be at least 0.01")
    @DecimalMax(value = "0.99", message = "Smoothing alpha cannot exceed 0.99")
    private Double smoothingAlpha;

    private Boolean includeTrend;

    @Min(value = 1, message = "Minimum data points must be at least 1")
    private Integer minDataPoints;

    public ForecastOverrides toOverrides() {
        return ForecastOverrides.builder()
                .method(method)
                .forecastPeriods(forecastPeriods)
                .confidenceLevel(confidenceLevel)
                .applySeasonality(applySeasonality)
                .seasonalFactors(seasonalFactors != null ? SeasonalFactors.of(seasonalFactors) : null)
                .movingAverageWindow(movingAverageWindow)
                .smoothingAlpha(smoothingAlpha)
                .includeTrend(includeTrend)
                .minDataPoints(minDataPoints)
                .build();
    }
}
