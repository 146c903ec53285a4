package com.bmsedge.forecast.model;

/**
 * Quality grade of a past forecast, by absolute percentage error.
 */
public enum ForecastAssessment {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static ForecastAssessment fromPercentageError(double percentageError) {
        if (percentageError <= 5) {
            return EXCELLENT;
        }
        if (percentageError <= 10) {
            return GOOD;
        }
        if (percentageError <= 20) {
            return FAIR;
        }
        return POOR;
    }
}
