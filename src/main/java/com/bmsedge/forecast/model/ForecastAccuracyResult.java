package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A past forecast checked against the revenue that was actually realised.
 * {@code bias} is positive when the forecast overestimated.
 */
@Value
@Builder
public class ForecastAccuracyResult {
    String clinicId;
    LocalDate periodStart;
    LocalDate periodEnd;
    double forecastedRevenue;
    double actualRevenue;
    long absoluteError;
    double percentageError;
    boolean withinConfidenceInterval;
    long bias;
    boolean needsRecalibration;
    ForecastAssessment assessment;
}
