package com.bmsedge.forecast.service.strategy;

import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.ForecastMethod;
import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import com.bmsedge.forecast.model.HistoricalRevenuePoint;
import com.bmsedge.forecast.model.ModelFitStatistics;
import com.bmsedge.forecast.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

import static com.bmsedge.forecast.util.ForecastingUtils.calculateModelFit;
import static com.bmsedge.forecast.util.ForecastingUtils.forecastPoint;
import static com.bmsedge.forecast.util.ForecastingUtils.generateForecastPoints;
import static com.bmsedge.forecast.util.ForecastingUtils.mean;
import static com.bmsedge.forecast.util.ForecastingUtils.round;
import static com.bmsedge.forecast.util.ForecastingUtils.seasonalFactor;
import static com.bmsedge.forecast.util.ForecastingUtils.zScore;

/**
 * AutoRegressive Integrated Moving Average forecasting.
 *
 * <p>The order is picked by AIC from a short list of candidates, the series is differenced
 * d times, and AR/MA coefficients are refined iteratively by conditional least squares.
 * Forecast error variance grows along the psi weights of the fitted model, so interval
 * widths follow the model instead of a fixed widening rule.
 */
public class ArimaStrategy implements ForecastingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ArimaStrategy.class);

    static final ArimaOrder SMALL_SAMPLE_ORDER = ArimaOrder.of(1, 1, 1);

    static final List<ArimaOrder> CANDIDATE_ORDERS = List.of(
            ArimaOrder.of(1, 1, 1),
            ArimaOrder.of(2, 1, 1),
            ArimaOrder.of(1, 1, 2),
            ArimaOrder.of(2, 1, 2),
            ArimaOrder.of(1, 0, 1),
            ArimaOrder.of(2, 0, 2)
    );

    static final int MIN_OBSERVATIONS_FOR_SEARCH = 12;
    static final int MAX_ITERATIONS = 100;
    static final double TOLERANCE = 1e-6;

    private static final double MA_LEARNING_RATE = 0.01;
    private static final double MA_BOUND = 0.99;
    private static final double INITIAL_MA = 0.1;
    private static final double MIN_SIGMA2 = 1e-10;

    @Override
    public String getName() {
        return ForecastMethod.ARIMA.key();
    }

    @Override
    public ForecastingStrategyResult calculate(List<HistoricalRevenuePoint> historicalData,
                                               double[] revenueValues,
                                               ForecastConfig config) {
        ArimaOrder order = selectOrder(revenueValues);
        DifferencedSeries series = difference(revenueValues, order.getD());
        ArimaCoefficients coefficients = fitModel(series.getDifferenced(), order);

        double[] residuals = residuals(series.getDifferenced(), order, coefficients);
        double[] projected = undifference(
                projectDifferenced(series.getDifferenced(), residuals, order, coefficients, config.getForecastPeriods()),
                series.getOriginalLast(), order.getD());
        double lastObserved = revenueValues[revenueValues.length - 1];
        for (int h = 0; h < projected.length; h++) {
            if (!Double.isFinite(projected[h])) {
                projected[h] = lastObserved;
            }
        }

        double[] errorVariances = forecastErrorVariances(config.getForecastPeriods(), order, coefficients);
        double z = zScore(config.getConfidenceLevel());

        List<ForecastedRevenuePoint> forecasts = generateForecastPoints(historicalData, config, (i, date) -> {
            double factor = seasonalFactor(date, config);
            double predicted = projected[i] * factor;
            double halfWidth = z * Math.sqrt(errorVariances[i]) * factor;
            return forecastPoint(date, i, predicted, halfWidth, config, factor, trendComponent(projected, i));
        });

        double[] fitted = fittedValues(revenueValues, residuals);
        ModelFitStatistics modelFit = calculateModelFit(revenueValues, fitted).toBuilder()
                .aic(aic(revenueValues.length, order, coefficients.getSigma2()))
                .build();

        return new ForecastingStrategyResult(forecasts, modelFit);
    }

    // ------------------------------------------------------------------
    // order selection
    // ------------------------------------------------------------------

    /**
     * Lowest-AIC order among {@link #CANDIDATE_ORDERS}; short series always use
     * {@link #SMALL_SAMPLE_ORDER}. Candidates too long for the data or with a non-finite
     * fit are skipped.
     */
    ArimaOrder selectOrder(double[] values) {
        if (values.length < MIN_OBSERVATIONS_FOR_SEARCH) {
            return SMALL_SAMPLE_ORDER;
        }

        ArimaOrder best = null;
        double bestAic = Double.POSITIVE_INFINITY;

        for (ArimaOrder candidate : CANDIDATE_ORDERS) {
            double[] differenced = difference(values, candidate.getD()).getDifferenced();
            if (differenced.length < candidate.getP() + candidate.getQ() + 2) {
                logger.debug("Skipping {}: only {} differenced observations", candidate, differenced.length);
                continue;
            }

            ArimaCoefficients coefficients = fitModel(differenced, candidate);
            double aic = aic(values.length, candidate, coefficients.getSigma2());
            if (!Double.isFinite(aic)) {
                logger.debug("Skipping {}: non-finite fit", candidate);
                continue;
            }
            if (aic < bestAic) {
                bestAic = aic;
                best = candidate;
            }
        }

        if (best == null) {
            return SMALL_SAMPLE_ORDER;
        }
        logger.debug("Selected {} with AIC {}", best, bestAic);
        return best;
    }

    static double aic(int n, ArimaOrder order, double sigma2) {
        return n * Math.log(Math.max(sigma2, MIN_SIGMA2)) + 2 * order.parameterCount();
    }

    // ------------------------------------------------------------------
    // differencing
    // ------------------------------------------------------------------

    /**
     * Result of d-th order differencing plus the last value of every level, which
     * {@link #undifference} needs to reverse it.
     */
    static final class DifferencedSeries {
        private final double[] differenced;
        private final double[] originalLast;

        DifferencedSeries(double[] differenced, double[] originalLast) {
            this.differenced = differenced;
            this.originalLast = originalLast;
        }

        double[] getDifferenced() {
            return differenced;
        }

        double[] getOriginalLast() {
            return originalLast;
        }
    }

    static DifferencedSeries difference(double[] values, int d) {
        double[] current = values.clone();
        double[] originalLast = new double[d];

        for (int level = 0; level < d; level++) {
            originalLast[level] = current.length > 0 ? current[current.length - 1] : 0;
            double[] diff = new double[Math.max(0, current.length - 1)];
            for (int j = 1; j < current.length; j++) {
                diff[j - 1] = current[j] - current[j - 1];
            }
            current = diff;
        }

        return new DifferencedSeries(current, originalLast);
    }

    static double[] undifference(double[] forecasts, double[] originalLast, int d) {
        double[] current = forecasts.clone();
        for (int level = d - 1; level >= 0; level--) {
            double running = originalLast[level];
            double[] integrated = new double[current.length];
            for (int i = 0; i < current.length; i++) {
                running += current[i];
                integrated[i] = running;
            }
            current = integrated;
        }
        return current;
    }

    // ------------------------------------------------------------------
    // fitting
    // ------------------------------------------------------------------

    /**
     * Conditional least squares refinement of the coefficients, stopping once the residual
     * variance changes by less than {@link #TOLERANCE} or after {@link #MAX_ITERATIONS}.
     */
    ArimaCoefficients fitModel(double[] differenced, ArimaOrder order) {
        double[] ar = initialArCoefficients(differenced, order.getP());
        double[] ma = new double[order.getQ()];
        Arrays.fill(ma, INITIAL_MA);
        double constant = mean(differenced);
        double previousSigma2 = Double.POSITIVE_INFINITY;

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double[] residuals = residuals(differenced, order, ar, ma, constant);

            ar = updateArCoefficients(differenced, residuals, order.getP(), constant);
            ma = updateMaCoefficients(residuals, ma);
            constant = mean(differenced) * (1 - sum(ar));

            double sigma2 = variance(residuals);
            if (Math.abs(sigma2 - previousSigma2) < TOLERANCE) {
                return new ArimaCoefficients(ar, ma, constant, sigma2);
            }
            previousSigma2 = sigma2;
        }

        double[] finalResiduals = residuals(differenced, order, ar, ma, constant);
        return new ArimaCoefficients(ar, ma, constant, variance(finalResiduals));
    }

    /**
     * Yule-Walker estimate from the sample autocorrelations at lags 1..p.
     */
    static double[] initialArCoefficients(double[] values, int p) {
        if (p == 0) {
            return new double[0];
        }

        int n = values.length;
        double avg = mean(values);
        double[] autocovariance = new double[p + 1];
        for (int lag = 0; lag <= p; lag++) {
            double s = 0;
            for (int i = lag; i < n; i++) {
                s += (values[i] - avg) * (values[i - lag] - avg);
            }
            autocovariance[lag] = n > 0 ? s / n : 0;
        }

        if (autocovariance[0] == 0) {
            return new double[p];
        }

        double[] r = new double[p];
        for (int lag = 1; lag <= p; lag++) {
            r[lag - 1] = autocovariance[lag] / autocovariance[0];
        }
        return MatrixUtil.levinsonDurbin(r, p);
    }

    /**
     * OLS of the de-meaned, residual-adjusted series on its own first p lags.
     */
    static double[] updateArCoefficients(double[] values, double[] residuals, int p, double constant) {
        if (p == 0) {
            return new double[0];
        }

        int n = values.length;
        double[] adjusted = new double[n];
        for (int i = 0; i < n; i++) {
            adjusted[i] = values[i] - constant - residuals[i];
        }

        int rows = Math.max(0, n - p);
        double[][] x = new double[rows][p];
        double[] y = new double[rows];
        for (int i = p; i < n; i++) {
            for (int j = 1; j <= p; j++) {
                x[i - p][j - 1] = adjusted[i - j];
            }
            y[i - p] = adjusted[i];
        }

        return MatrixUtil.solveNormalEquations(x, y, p);
    }

    /**
     * One gradient step per MA coefficient on the residual lag covariance, clamped to keep
     * the model invertible.
     */
    static double[] updateMaCoefficients(double[] residuals, double[] ma) {
        int q = ma.length;
        double[] updated = ma.clone();
        if (q == 0 || residuals.length == 0) {
            return updated;
        }

        for (int j = 0; j < q; j++) {
            double gradient = 0;
            for (int i = j + 1; i < residuals.length; i++) {
                gradient += residuals[i] * residuals[i - j - 1];
            }
            gradient = gradient * 2 / residuals.length;
            updated[j] = Math.max(-MA_BOUND, Math.min(MA_BOUND, updated[j] - MA_LEARNING_RATE * gradient));
        }
        return updated;
    }

    static double[] residuals(double[] values, ArimaOrder order, ArimaCoefficients coefficients) {
        return residuals(values, order, coefficients.getAr(), coefficients.getMa(), coefficients.getConstant());
    }

    /**
     * One-step-ahead residuals; the first max(p, q) entries are left at zero.
     */
    static double[] residuals(double[] values, ArimaOrder order, double[] ar, double[] ma, double constant) {
        int n = values.length;
        double[] residuals = new double[n];
        int start = Math.max(order.getP(), order.getQ());

        for (int t = start; t < n; t++) {
            double prediction = constant;
            for (int i = 0; i < order.getP(); i++) {
                prediction += ar[i] * values[t - i - 1];
            }
            for (int i = 0; i < order.getQ(); i++) {
                prediction += ma[i] * residuals[t - i - 1];
            }
            residuals[t] = values[t] - prediction;
        }
        return residuals;
    }

    /**
     * In-sample fitted values on the original scale. A one-step residual is the same on the
     * differenced and the original scale, so fitted = actual - residual once the
     * differencing offset is passed.
     */
    static double[] fittedValues(double[] original, double[] residuals) {
        int offset = original.length - residuals.length;
        double[] fitted = new double[original.length];
        for (int i = 0; i < original.length; i++) {
            if (i < offset) {
                fitted[i] = original[i];
            } else if (Double.isFinite(residuals[i - offset])) {
                fitted[i] = original[i] - residuals[i - offset];
            } else {
                // diverged recursion: fall back to the naive previous-value prediction
                fitted[i] = i > 0 ? original[i - 1] : original[i];
            }
        }
        return fitted;
    }

    // ------------------------------------------------------------------
    // forecasting
    // ------------------------------------------------------------------

    /**
     * Recursive projection of the differenced series; unknown future shocks are zero.
     */
    static double[] projectDifferenced(double[] differenced, double[] residuals, ArimaOrder order,
                                       ArimaCoefficients coefficients, int periods) {
        int n = differenced.length;
        double[] ar = coefficients.getAr();
        double[] ma = coefficients.getMa();
        double[] projected = new double[periods];

        for (int h = 0; h < periods; h++) {
            double forecast = coefficients.getConstant();

            for (int i = 0; i < order.getP(); i++) {
                int idx = n - 1 - i + h;
                double lagged;
                if (idx < 0) {
                    lagged = 0;
                } else if (idx < n) {
                    lagged = differenced[idx];
                } else {
                    lagged = projected[idx - n];
                }
                forecast += ar[i] * lagged;
            }

            for (int i = 0; i < order.getQ(); i++) {
                int idx = n - 1 - i + h;
                if (idx >= 0 && idx < n) {
                    forecast += ma[i] * residuals[idx];
                }
            }

            projected[h] = forecast;
        }
        return projected;
    }

    /**
     * Horizon-h variance {@code sigma2 * (1 + sum of the first h squared psi weights)}.
     */
    static double[] forecastErrorVariances(int periods, ArimaOrder order, ArimaCoefficients coefficients) {
        double sigma2 = coefficients.getSigma2();
        double[] psi = psiWeights(periods, order, coefficients);
        double[] variances = new double[periods];

        for (int h = 0; h < periods; h++) {
            double variance = sigma2;
            for (int i = 0; i < h; i++) {
                variance += sigma2 * psi[i] * psi[i];
            }
            variances[h] = variance;
        }
        return variances;
    }

    /**
     * Weights psi_1..psi_periods of the MA(infinity) representation (psi_0 = 1 is implied).
     */
    static double[] psiWeights(int periods, ArimaOrder order, ArimaCoefficients coefficients) {
        double[] ar = coefficients.getAr();
        double[] ma = coefficients.getMa();
        double[] psi = new double[periods + 1];
        psi[0] = 1;

        for (int j = 1; j <= periods; j++) {
            double weight = 0;
            for (int i = 0; i < Math.min(j, order.getP()); i++) {
                weight += ar[i] * psi[j - i - 1];
            }
            if (j <= order.getQ()) {
                weight += ma[j - 1];
            }
            psi[j] = weight;
        }
        return Arrays.copyOfRange(psi, 1, periods + 1);
    }

    static double trendComponent(double[] forecasts, int periodIndex) {
        if (periodIndex == 0 || forecasts.length < 2) {
            return 0;
        }
        return round(forecasts[periodIndex] - forecasts[periodIndex - 1]);
    }

    // ------------------------------------------------------------------

    private static double sum(double[] values) {
        double s = 0;
        for (double v : values) {
            s += v;
        }
        return s;
    }

    static double variance(double[] values) {
        if (values.length < 2) {
            return 0;
        }
        double avg = mean(values);
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - avg) * (v - avg);
        }
        return sumSq / (values.length - 1);
    }
}
