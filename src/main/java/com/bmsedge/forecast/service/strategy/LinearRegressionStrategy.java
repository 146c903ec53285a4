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
 * Ordinary least squares trend line over the period index, with classical prediction
 * intervals that widen with the distance from the centre of the data.
 */
public class LinearRegressionStrategy implements ForecastingStrategy {

    @Override
    public String getName() {
        return ForecastMethod.LINEAR_REGRESSION.key();
    }

    @Override
    public ForecastingStrategyResult calculate(List<HistoricalRevenuePoint> historicalData,
                                               double[] revenueValues,
                                               ForecastConfig config) {
        int n = revenueValues.length;

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += revenueValues[i];
            sumXY += i * revenueValues[i];
            sumX2 += (double) i * i;
        }

        double denominator = n * sumX2 - sumX * sumX;
        double slope = denominator != 0 ? (n * sumXY - sumX * sumY) / denominator : 0;
        double intercept = (sumY - slope * sumX) / n;

        double[] fitted = new double[n];
        double sse = 0;
        for (int i = 0; i < n; i++) {
            fitted[i] = intercept + slope * i;
            sse += (revenueValues[i] - fitted[i]) * (revenueValues[i] - fitted[i]);
        }

        double xMean = sumX / n;
        double sxx = sumX2 - n * xMean * xMean;
        double stdError = n > 2 ? Math.sqrt(sse / (n - 2)) : 0;
        double z = zScore(config.getConfidenceLevel());

        List<ForecastedRevenuePoint> forecasts = generateForecastPoints(historicalData, config, (i, date) -> {
            int horizon = i + 1;
            double x = n - 1 + horizon;
            double factor = seasonalFactor(date, config);
            double leverage = sxx > 0 ? (x - xMean) * (x - xMean) / sxx : 0;
            double halfWidth = z * stdError * Math.sqrt(1 + 1.0 / n + leverage) * factor;
            double predicted = (intercept + slope * x) * factor;
            return forecastPoint(date, i, predicted, halfWidth, config, factor, round(slope * horizon));
        });

        ModelFitStatistics modelFit = calculateModelFit(revenueValues, fitted).toBuilder()
                .degreesOfFreedom(Math.max(0, n - 2))
                .build();
        return new ForecastingStrategyResult(forecasts, modelFit);
    }
}
