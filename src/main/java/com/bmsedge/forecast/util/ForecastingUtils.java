package com.bmsedge.forecast.util;

import com.bmsedge.forecast.model.ForecastConfidenceInterval;
import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.ForecastGranularity;
import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import com.bmsedge.forecast.model.HistoricalRevenuePoint;
import com.bmsedge.forecast.model.ModelFitStatistics;
import com.bmsedge.forecast.model.SeasonalFactors;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Numeric helpers shared by every forecasting strategy.
 */
public class ForecastingUtils {

    // {confidence level, two-sided z-score}
    private static final double[][] Z_SCORES = {
            {0.80, 1.282},
            {0.85, 1.440},
            {0.90, 1.645},
            {0.95, 1.960},
            {0.98, 2.326},
            {0.99, 2.576}
    };

    /**
     * Builds the point of one horizon step.
     */
    @FunctionalInterface
    public interface ForecastPointFactory {
        ForecastedRevenuePoint create(int periodIndex, LocalDate date);
    }

    private ForecastingUtils() {
    }

    /**
     * Two-sided z-score of the tabulated confidence level nearest to the requested one.
     */
    public static double zScore(double confidenceLevel) {
        double best = Z_SCORES[0][1];
        double bestDistance = Double.MAX_VALUE;
        for (double[] entry : Z_SCORES) {
            double distance = Math.abs(entry[0] - confidenceLevel);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = entry[1];
            }
        }
        return best;
    }

    public static double seasonalFactor(LocalDate date, SeasonalFactors factors) {
        SeasonalFactors table = factors != null ? factors : SeasonalFactors.defaults();
        return table.factorFor(date.getMonth());
    }

    /**
     * Seasonal multiplier for {@code date}, or 1.0 when seasonality is switched off.
     */
    public static double seasonalFactor(LocalDate date, ForecastConfig config) {
        return config.isApplySeasonality() ? seasonalFactor(date, config.getSeasonalFactors()) : 1.0;
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * Mean of {@code values[from, to)}; 0 for an empty range.
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Sample standard deviation of {@code values[from, to)}; 0 for fewer than two values.
     */
    public static double sampleStandardDeviation(double[] values, int from, int to) {
        int count = to - from;
        if (count < 2) {
            return 0;
        }
        double avg = mean(values, from, to);
        double sumSq = 0;
        for (int i = from; i < to; i++) {
            sumSq += (values[i] - avg) * (values[i] - avg);
        }
        return Math.sqrt(sumSq / (count - 1));
    }

    public static double round(double value) {
        return Math.round(value);
    }

    public static double roundToOneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }

    public static boolean isHighUncertainty(int periodIndex, int forecastPeriods) {
        return periodIndex >= forecastPeriods / 2.0;
    }

    /**
     * In-sample fit statistics of {@code fitted} against {@code actual}. R² is clamped to
     * [0, 1] and is 0 when the actual series has no variance.
     */
    public static ModelFitStatistics calculateModelFit(double[] actual, double[] fitted) {
        int n = actual.length;
        if (n == 0) {
            return ModelFitStatistics.builder().build();
        }

        double actualMean = mean(actual);
        double ssTot = 0;
        double ssRes = 0;
        double absSum = 0;
        double apeSum = 0;
        int apeCount = 0;

        for (int i = 0; i < n; i++) {
            double error = actual[i] - fitted[i];
            ssTot += (actual[i] - actualMean) * (actual[i] - actualMean);
            ssRes += error * error;
            absSum += Math.abs(error);
            if (actual[i] != 0) {
                apeSum += Math.abs(error / actual[i]);
                apeCount++;
            }
        }

        double rSquared = ssTot > 0 ? 1 - ssRes / ssTot : 0;
        if (!Double.isFinite(rSquared)) {
            rSquared = 0;
        }

        return ModelFitStatistics.builder()
                .rSquared(Math.max(0, Math.min(1, rSquared)))
                .mae(absSum / n)
                .mape(apeCount > 0 ? apeSum / apeCount * 100 : 0)
                .rmse(Math.sqrt(ssRes / n))
                .dataPointsUsed(n)
                .build();
    }

    /**
     * Generates one point per forecast period, dated one granularity unit after the previous
     * one and starting right after the last historical date.
     */
    public static List<ForecastedRevenuePoint> generateForecastPoints(List<HistoricalRevenuePoint> history,
                                                                     ForecastConfig config,
                                                                     ForecastPointFactory factory) {
        LocalDate lastDate = history.get(history.size() - 1).getDate();
        ForecastGranularity granularity = config.getGranularity() != null
                ? config.getGranularity() : ForecastGranularity.MONTHLY;

        List<ForecastedRevenuePoint> points = new ArrayList<>(config.getForecastPeriods());
        for (int i = 0; i < config.getForecastPeriods(); i++) {
            points.add(factory.create(i, granularity.advance(lastDate, i + 1)));
        }
        return points;
    }

    /**
     * Assembles a forecast point from a raw prediction and interval half-width. The
     * prediction is floored at zero before the interval is derived from it, so
     * {@code 0 <= lower <= predicted <= upper} always holds.
     */
    public static ForecastedRevenuePoint forecastPoint(LocalDate date,
                                                       int periodIndex,
                                                       double rawPredicted,
                                                       double halfWidth,
                                                       ForecastConfig config,
                                                       Double seasonalFactor,
                                                       Double trendComponent) {
        double predicted = Double.isFinite(rawPredicted) ? Math.max(0, rawPredicted) : 0;
        double width = Double.isFinite(halfWidth) ? Math.abs(halfWidth) : 0;

        return ForecastedRevenuePoint.builder()
                .date(date)
                .predicted(round(predicted))
                .confidenceInterval(new ForecastConfidenceInterval(
                        Math.max(0, round(predicted - width)),
                        round(predicted + width),
                        config.getConfidenceLevel()))
                .seasonalFactor(seasonalFactor)
                .trendComponent(trendComponent)
                .highUncertainty(isHighUncertainty(periodIndex, config.getForecastPeriods()))
                .build();
    }
}
