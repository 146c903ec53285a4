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
import static com.bmsedge.forecast.util.ForecastingUtils.round;
import static com.bmsedge.forecast.util.ForecastingUtils.seasonalFactor;
import static com.bmsedge.forecast.util.ForecastingUtils.zScore;

/**
 * Holt's linear method: a smoothed level plus a smoothed additive trend.
 */
public class ExponentialSmoothingStrategy implements ForecastingStrategy {

    static final double TREND_SMOOTHING = 0.1;

    @Override
    public String getName() {
        return ForecastMethod.EXPONENTIAL_SMOOTHING.key();
    }

    @Override
    public ForecastingStrategyResult calculate(List<HistoricalRevenuePoint> historicalData,
                                               double[] revenueValues,
                                               ForecastConfig config) {
        int n = revenueValues.length;
        double alpha = config.getSmoothingAlpha();
        boolean withTrend = config.isIncludeTrend() && n > 1;

        double level = revenueValues[0];
        double trend = withTrend ? revenueValues[1] - revenueValues[0] : 0;

        double[] fitted = new double[n];
        fitted[0] = revenueValues[0];
        double squaredErrors = 0;

        for (int t = 1; t < n; t++) {
            // one-step-ahead prediction made before seeing v[t]
            fitted[t] = level + trend;
            double error = revenueValues[t] - fitted[t];
            squaredErrors += error * error;

            double previousLevel = level;
            level = alpha * revenueValues[t] + (1 - alpha) * (level + trend);
            if (withTrend) {
                trend = TREND_SMOOTHING * (level - previousLevel) + (1 - TREND_SMOOTHING) * trend;
            }
        }

        double stdError = n > 1 ? Math.sqrt(squaredErrors / (n - 1)) : 0;
        double z = zScore(config.getConfidenceLevel());
        double finalLevel = level;
        double finalTrend = trend;

        List<ForecastedRevenuePoint> forecasts = generateForecastPoints(historicalData, config, (i, date) -> {
            int horizon = i + 1;
            double factor = seasonalFactor(date, config);
            double predicted = (finalLevel + finalTrend * horizon) * factor;
            double halfWidth = z * stdError * Math.sqrt(1 + 0.1 * horizon) * factor;
            return forecastPoint(date, i, predicted, halfWidth, config, factor, round(finalTrend * horizon));
        });

        ModelFitStatistics modelFit = calculateModelFit(revenueValues, fitted);
        return new ForecastingStrategyResult(forecasts, modelFit);
    }
}
