package com.bmsedge.forecast.service;

import com.bmsedge.forecast.dto.ForecastAccuracyRequest;
import com.bmsedge.forecast.exception.InvalidRevenueDataException;
import com.bmsedge.forecast.model.ForecastAccuracyResult;
import com.bmsedge.forecast.model.ForecastAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.bmsedge.forecast.util.ForecastingUtils.roundToOneDecimal;

/**
 * Compares a previously issued forecast with the realised revenue of the same period.
 */
public class ForecastAccuracyService {

    private static final Logger logger = LoggerFactory.getLogger(ForecastAccuracyService.class);

    public static final double DEFAULT_RECALIBRATION_THRESHOLD = 25;

    private final double recalibrationThreshold;

    public ForecastAccuracyService() {
        this(DEFAULT_RECALIBRATION_THRESHOLD);
    }

    public ForecastAccuracyService(double recalibrationThreshold) {
        this.recalibrationThreshold = recalibrationThreshold;
    }

    public ForecastAccuracyResult compare(ForecastAccuracyRequest request) {
        double forecasted = request.getForecastedRevenue();
        double actual = request.getActualRevenue();
        if (forecasted < 0 || actual < 0) {
            throw new InvalidRevenueDataException("Revenue values cannot be negative");
        }
        if (request.getPeriodStart() != null && request.getPeriodEnd() != null
                && request.getPeriodEnd().isBefore(request.getPeriodStart())) {
            throw new InvalidRevenueDataException("Period end " + request.getPeriodEnd()
                    + " is before period start " + request.getPeriodStart());
        }

        logger.info("Comparing forecast to actual revenue for clinic {}", request.getClinicId());

        double absoluteError = Math.abs(forecasted - actual);
        double percentageError;
        if (actual != 0) {
            percentageError = absoluteError / actual * 100;
        } else {
            percentageError = forecasted != 0 ? 100 : 0;
        }

        // an absent bound is open on that side
        double lower = request.getIntervalLower() != null ? request.getIntervalLower() : Double.NEGATIVE_INFINITY;
        double upper = request.getIntervalUpper() != null ? request.getIntervalUpper() : Double.POSITIVE_INFINITY;

        ForecastAssessment assessment = ForecastAssessment.fromPercentageError(percentageError);
        boolean needsRecalibration = percentageError > recalibrationThreshold;

        ForecastAccuracyResult result = ForecastAccuracyResult.builder()
                .clinicId(request.getClinicId())
                .periodStart(request.getPeriodStart())
                .periodEnd(request.getPeriodEnd())
                .forecastedRevenue(forecasted)
                .actualRevenue(actual)
                .absoluteError(Math.round(absoluteError))
                .percentageError(roundToOneDecimal(percentageError))
                .withinConfidenceInterval(actual >= lower && actual <= upper)
                .bias(Math.round(forecasted - actual))
                .needsRecalibration(needsRecalibration)
                .assessment(assessment)
                .build();

        if (needsRecalibration) {
            logger.warn("Forecast for clinic {} missed by {}%, recalibration recommended",
                    request.getClinicId(), result.getPercentageError());
        }
        logger.info("Forecast accuracy for clinic {}: {} ({}%)",
                request.getClinicId(), assessment, result.getPercentageError());
        return result;
    }

    public double getRecalibrationThreshold() {
        return recalibrationThreshold;
    }
}
