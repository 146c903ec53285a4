package com.bmsedge.forecast.service.strategy;

import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.ForecastMethod;
import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import com.bmsedge.forecast.model.HistoricalRevenuePoint;
import com.bmsedge.forecast.model.ModelFitStatistics;

import java.util.List;

import static com.bmsedge.forecast.util.ForecastingUtils.calculateModelFit;
import static com.bmsedge.forecast.util.ForecastingUtils.forecastPoint;
import static com.bmsedge.forecast.util.ForecastingUtils.generateForecastPoints;
import static com.bmsedge.forecast.util.ForecastingUtils.mean;
import static com.bmsedge.forecast.util.ForecastingUtils.sampleStandardDeviation;
import static com.bmsedge.forecast.util.ForecastingUtils.seasonalFactor;
import static com.bmsedge.forecast.util.ForecastingUtils.zScore;

/**
 * Flat baseline: the mean of the most recent window is the estimate for every horizon,
 * with an interval widening as {@code sqrt(1 + h / window)}.
 */
public class MovingAverageStrategy implements ForecastingStrategy {

    @Override
    public String getName() {
        return ForecastMethod.MOVING_AVERAGE.key();
    }

    @Override
    public ForecastingStrategyResult calculate(List<HistoricalRevenuePoint> historicalData,
                                               double[] revenueValues,
                                               ForecastConfig config) {
        int n = revenueValues.length;
        int window = Math.max(1, Math.min(config.getMovingAverageWindow(), n));

        double average = mean(revenueValues, n - window, n);
        double stdDev = sampleStandardDeviation(revenueValues, n - window, n);
        double z = zScore(config.getConfidenceLevel());

        List<ForecastedRevenuePoint> forecasts = generateForecastPoints(historicalData, config, (i, date) -> {
            double factor = seasonalFactor(date, config);
            int horizon = i + 1;
            double halfWidth = z * stdDev * Math.sqrt(1 + (double) horizon / window) * factor;
            return forecastPoint(date, i, average * factor, halfWidth, config, factor, null);
        });

        ModelFitStatistics modelFit = calculateModelFit(revenueValues, fittedValues(revenueValues, window));
        return new ForecastingStrategyResult(forecasts, modelFit);
    }

    /**
     * Expanding mean until the window fills up, rolling window mean afterwards.
     */
    static double[] fittedValues(double[] values, int window) {
        double[] fitted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            fitted[i] = mean(values, Math.max(0, i - window + 1), i + 1);
        }
        return fitted;
    }
}
