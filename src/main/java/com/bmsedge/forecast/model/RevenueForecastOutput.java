package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Complete result of one forecast call. New fields may be added; existing ones keep their
 * meaning.
 */
@Value
@Builder
public class RevenueForecastOutput {
    String clinicId;
    String method;
    ForecastConfidenceLevel confidenceLevel;
    @Singular
    List<ForecastedRevenuePoint> forecasts;
    long totalPredictedRevenue;
    ForecastConfidenceInterval totalConfidenceInterval;
    ModelFitStatistics modelFit;
    TrendAnalysis trendAnalysis;
    String summary;
    @Singular
    List<String> recommendedActions;
    @Singular
    List<String> insights;
    String modelVersion;
    Instant calculatedAt;
}
