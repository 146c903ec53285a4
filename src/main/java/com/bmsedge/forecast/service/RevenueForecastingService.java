package com.bmsedge.forecast.service;

import com.bmsedge.forecast.exception.ForecastingException;
import com.bmsedge.forecast.exception.InsufficientDataException;
import com.bmsedge.forecast.exception.InvalidForecastConfigException;
import com.bmsedge.forecast.exception.InvalidRevenueDataException;
import com.bmsedge.forecast.exception.UnknownForecastMethodException;
import com.bmsedge.forecast.model.BatchForecastItem;
import com.bmsedge.forecast.model.BatchForecastResult;
import com.bmsedge.forecast.model.ForecastConfidenceInterval;
import com.bmsedge.forecast.model.ForecastConfidenceLevel;
import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.ForecastMethod;
import com.bmsedge.forecast.model.ForecastOverrides;
import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import com.bmsedge.forecast.model.HistoricalRevenueInput;
import com.bmsedge.forecast.model.HistoricalRevenuePoint;
import com.bmsedge.forecast.model.ModelFitStatistics;
import com.bmsedge.forecast.model.RevenueForecastOutput;
import com.bmsedge.forecast.model.RevenueTrend;
import com.bmsedge.forecast.model.TrendAnalysis;
import com.bmsedge.forecast.service.strategy.ArimaStrategy;
import com.bmsedge.forecast.service.strategy.ExponentialSmoothingStrategy;
import com.bmsedge.forecast.service.strategy.ForecastingStrategy;
import com.bmsedge.forecast.service.strategy.ForecastingStrategyResult;
import com.bmsedge.forecast.service.strategy.LinearRegressionStrategy;
import com.bmsedge.forecast.service.strategy.MovingAverageStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.bmsedge.forecast.util.ForecastingUtils.isHighUncertainty;
import static com.bmsedge.forecast.util.ForecastingUtils.roundToOneDecimal;

/**
 * Predicts future clinic revenue from historical revenue.
 *
 * <p>Forecasting algorithms are {@link ForecastingStrategy} instances registered by name.
 * A request names one of them, or {@code ensemble} to run every registered strategy and
 * combine the results weighted by each strategy's in-sample R². Registering a new strategy
 * makes it available by name and part of the ensemble without further changes here.
 */
public class RevenueForecastingService {

    private static final Logger logger = LoggerFactory.getLogger(RevenueForecastingService.class);

    public static final String ENSEMBLE = ForecastMethod.ENSEMBLE.key();

    static final double MIN_ENSEMBLE_WEIGHT = 0.1;
    private static final double VOLATILITY_THRESHOLD = 30;
    private static final double GROWTH_THRESHOLD = 2;
    private static final double LARGE_REVENUE_THRESHOLD = 500_000;

    private final ForecastConfig defaultConfig;
    private final String modelVersion;
    private final boolean parallelEnsemble;
    private final Clock clock;
    private final NavigableMap<String, ForecastingStrategy> strategies = new ConcurrentSkipListMap<>();

    public RevenueForecastingService() {
        this(RevenueForecastingServiceConfig.defaults(), Clock.systemUTC());
    }

    public RevenueForecastingService(RevenueForecastingServiceConfig config, Clock clock) {
        this.defaultConfig = ForecastConfig.builder()
                .method(config.getDefaultMethod())
                .forecastPeriods(config.getDefaultForecastPeriods())
                .confidenceLevel(config.getDefaultConfidenceLevel())
                .applySeasonality(config.isDefaultApplySeasonality())
                .movingAverageWindow(config.getDefaultMovingAverageWindow())
                .smoothingAlpha(config.getDefaultSmoothingAlpha())
                .includeTrend(config.isDefaultIncludeTrend())
                .minDataPoints(config.getMinDataPoints())
                .build();
        this.modelVersion = config.getModelVersion();
        this.parallelEnsemble = config.isParallelEnsemble();
        this.clock = clock;

        List<ForecastingStrategy> initial = config.getStrategies() != null
                ? config.getStrategies() : defaultStrategies();
        if (initial.isEmpty()) {
            throw new IllegalArgumentException("At least one forecasting strategy is required");
        }
        initial.forEach(this::addStrategy);

        logger.info("Revenue forecasting service {} initialized with strategies {}",
                modelVersion, strategies.keySet());
    }

    public static List<ForecastingStrategy> defaultStrategies() {
        return List.of(
                new MovingAverageStrategy(),
                new ExponentialSmoothingStrategy(),
                new LinearRegressionStrategy(),
                new ArimaStrategy());
    }

    // ============= FORECASTING =============

    public RevenueForecastOutput forecast(HistoricalRevenueInput input) {
        return forecast(input, ForecastOverrides.none());
    }

    /**
     * Generates a forecast for one clinic.
     *
     * @throws InsufficientDataException   fewer data points than {@code minDataPoints}
     * @throws InvalidRevenueDataException a negative revenue value
     * @throws UnknownForecastMethodException no strategy registered under the method name
     * @throws InvalidForecastConfigException out-of-range configuration values
     */
    public RevenueForecastOutput forecast(HistoricalRevenueInput input, ForecastOverrides overrides) {
        long startTime = clock.millis();
        ForecastConfig config = defaultConfig.merge(overrides).toBuilder()
                .granularity(input.getGranularity())
                .build();

        validateConfig(config);
        validateInput(input, config);

        logger.info("Generating revenue forecast for clinic {} using {} ({} periods, {} data points)",
                input.getClinicId(), config.getMethod(), config.getForecastPeriods(), input.getDataPoints().size());

        List<HistoricalRevenuePoint> sortedData = new ArrayList<>(input.getDataPoints());
        sortedData.sort(Comparator.comparing(HistoricalRevenuePoint::getDate));
        double[] revenueValues = sortedData.stream().mapToDouble(HistoricalRevenuePoint::getRevenue).toArray();

        ForecastingStrategyResult result = ENSEMBLE.equals(config.getMethod())
                ? ensembleForecast(sortedData, revenueValues, config)
                : strategies.get(config.getMethod()).calculate(sortedData, revenueValues, config);

        List<ForecastedRevenuePoint> forecasts = result.getForecasts();
        ModelFitStatistics modelFit = result.getModelFit();
        TrendAnalysis trendAnalysis = analyzeTrend(revenueValues);

        long totalPredictedRevenue = Math.round(forecasts.stream().mapToDouble(ForecastedRevenuePoint::getPredicted).sum());
        ForecastConfidenceInterval totalInterval = totalConfidenceInterval(forecasts, config.getConfidenceLevel());
        ForecastConfidenceLevel confidenceLevel = determineConfidenceLevel(modelFit, sortedData.size());

        RevenueForecastOutput output = RevenueForecastOutput.builder()
                .clinicId(input.getClinicId())
                .method(config.getMethod())
                .confidenceLevel(confidenceLevel)
                .forecasts(forecasts)
                .totalPredictedRevenue(totalPredictedRevenue)
                .totalConfidenceInterval(totalInterval)
                .modelFit(modelFit)
                .trendAnalysis(trendAnalysis)
                .summary(generateSummary(totalPredictedRevenue, trendAnalysis, confidenceLevel, config, input.getCurrency()))
                .recommendedActions(generateRecommendedActions(trendAnalysis, confidenceLevel, totalPredictedRevenue))
                .insights(generateInsights(trendAnalysis, confidenceLevel, modelFit))
                .modelVersion(modelVersion)
                .calculatedAt(clock.instant())
                .build();

        logger.info("Forecast for clinic {} completed in {}ms: total={}, trend={}, confidence={}",
                input.getClinicId(), clock.millis() - startTime, totalPredictedRevenue,
                trendAnalysis.getDirection(), confidenceLevel);
        return output;
    }

    /**
     * Forecasts several clinics with the same overrides. A failing clinic aborts the batch
     * unless {@code continueOnError} is set, in which case its error is recorded and the
     * remaining clinics are still processed.
     */
    public BatchForecastResult forecastBatch(List<HistoricalRevenueInput> inputs,
                                             ForecastOverrides overrides,
                                             boolean continueOnError) {
        long startTime = clock.millis();
        logger.info("Starting batch revenue forecast for {} clinics", inputs.size());

        BatchForecastResult.BatchForecastResultBuilder builder = BatchForecastResult.builder();
        int succeeded = 0;
        int failed = 0;
        long totalPredictedRevenue = 0;
        double totalGrowthRate = 0;
        int growingClinics = 0;
        int decliningClinics = 0;

        for (HistoricalRevenueInput input : inputs) {
            try {
                RevenueForecastOutput output = forecast(input, overrides);
                succeeded++;
                totalPredictedRevenue += output.getTotalPredictedRevenue();
                totalGrowthRate += output.getTrendAnalysis().getAnnualizedGrowthRate();
                if (output.getTrendAnalysis().getDirection() == RevenueTrend.GROWING) {
                    growingClinics++;
                } else if (output.getTrendAnalysis().getDirection() == RevenueTrend.DECLINING) {
                    decliningClinics++;
                }
                builder.result(BatchForecastItem.success(input.getClinicId(), output));
            } catch (ForecastingException e) {
                if (!continueOnError) {
                    throw e;
                }
                failed++;
                logger.warn("Forecast for clinic {} failed: {}", input.getClinicId(), e.getMessage());
                builder.result(BatchForecastItem.failure(input.getClinicId(), e.getCode(), e.getMessage()));
            }
        }

        long duration = clock.millis() - startTime;
        logger.info("Batch revenue forecast completed in {}ms. Success: {}, Failed: {}", duration, succeeded, failed);

        return builder
                .total(inputs.size())
                .succeeded(succeeded)
                .failed(failed)
                .aggregateStats(new BatchForecastResult.AggregateStats(
                        totalPredictedRevenue,
                        succeeded > 0 ? totalGrowthRate / succeeded : 0,
                        growingClinics,
                        decliningClinics))
                .durationMs(duration)
                .build();
    }

    // ============= STRATEGY REGISTRY =============

    /**
     * Registers a strategy under its name, replacing any strategy of the same name.
     */
    public void addStrategy(ForecastingStrategy strategy) {
        if (ENSEMBLE.equals(strategy.getName())) {
            throw new IllegalArgumentException("'" + ENSEMBLE + "' is reserved for the combined forecast");
        }
        strategies.put(strategy.getName(), strategy);
    }

    /**
     * Names of the registered strategies, sorted.
     */
    public List<String> getAvailableStrategies() {
        return List.copyOf(strategies.keySet());
    }

    public String getModelVersion() {
        return modelVersion;
    }

    // ============= ENSEMBLE =============

    /**
     * Runs every registered strategy and combines them per horizon. Results are gathered in
     * strategy-name order whether or not they were computed in parallel.
     */
    private ForecastingStrategyResult ensembleForecast(List<HistoricalRevenuePoint> historicalData,
                                                       double[] revenueValues,
                                                       ForecastConfig config) {
        List<String> names = new ArrayList<>(strategies.keySet());
        List<ForecastingStrategy> members = names.stream().map(strategies::get).collect(Collectors.toList());

        Stream<ForecastingStrategy> stream = parallelEnsemble ? members.parallelStream() : members.stream();
        List<ForecastingStrategyResult> results = stream
                .map(strategy -> strategy.calculate(historicalData, revenueValues, config))
                .collect(Collectors.toList());

        List<ModelFitStatistics> fits = results.stream()
                .map(ForecastingStrategyResult::getModelFit)
                .collect(Collectors.toList());
        double[] weights = ensembleWeights(fits);
        if (logger.isDebugEnabled()) {
            for (int i = 0; i < names.size(); i++) {
                logger.debug("Ensemble weight {}={} (R²={})", names.get(i), weights[i], fits.get(i).getRSquared());
            }
        }

        int seasonalSource = Math.max(0, names.indexOf(ForecastMethod.MOVING_AVERAGE.key()));
        int trendSource = Math.max(0, names.indexOf(ForecastMethod.LINEAR_REGRESSION.key()));

        List<ForecastedRevenuePoint> forecasts = new ArrayList<>(config.getForecastPeriods());
        for (int period = 0; period < config.getForecastPeriods(); period++) {
            List<ForecastedRevenuePoint> points = new ArrayList<>(results.size());
            for (ForecastingStrategyResult result : results) {
                points.add(result.getForecasts().get(period));
            }
            forecasts.add(combineForecastPoint(points, weights, seasonalSource, trendSource, config, period));
        }

        return new ForecastingStrategyResult(forecasts, combineModelFit(fits, weights, revenueValues.length));
    }

    /**
     * Normalised weights {@code max(0.1, R²_i) / sum_j max(0.1, R²_j)}; the floor keeps a
     * poorly fitting strategy from dropping out entirely.
     */
    static double[] ensembleWeights(List<ModelFitStatistics> fits) {
        double total = 0;
        for (ModelFitStatistics fit : fits) {
            total += flooredWeight(fit);
        }
        double[] weights = new double[fits.size()];
        for (int i = 0; i < fits.size(); i++) {
            weights[i] = flooredWeight(fits.get(i)) / total;
        }
        return weights;
    }

    private static double flooredWeight(ModelFitStatistics fit) {
        double rSquared = Double.isFinite(fit.getRSquared()) ? fit.getRSquared() : 0;
        return Math.max(MIN_ENSEMBLE_WEIGHT, rSquared);
    }

    private static double weightedAverage(double[] values, double[] weights) {
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * weights[i];
        }
        return sum;
    }

    private ForecastedRevenuePoint combineForecastPoint(List<ForecastedRevenuePoint> points,
                                                        double[] weights,
                                                        int seasonalSource,
                                                        int trendSource,
                                                        ForecastConfig config,
                                                        int period) {
        double[] predicted = points.stream().mapToDouble(ForecastedRevenuePoint::getPredicted).toArray();
        double[] lower = points.stream().mapToDouble(p -> p.getConfidenceInterval().getLower()).toArray();
        double[] upper = points.stream().mapToDouble(p -> p.getConfidenceInterval().getUpper()).toArray();

        return ForecastedRevenuePoint.builder()
                .date(points.get(0).getDate())
                .predicted(Math.round(weightedAverage(predicted, weights)))
                .confidenceInterval(new ForecastConfidenceInterval(
                        Math.max(0, Math.round(weightedAverage(lower, weights))),
                        Math.round(weightedAverage(upper, weights)),
                        config.getConfidenceLevel()))
                .seasonalFactor(points.get(seasonalSource).getSeasonalFactor())
                .trendComponent(points.get(trendSource).getTrendComponent())
                .highUncertainty(isHighUncertainty(period, config.getForecastPeriods()))
                .build();
    }

    private static ModelFitStatistics combineModelFit(List<ModelFitStatistics> fits, double[] weights, int dataPointsUsed) {
        return ModelFitStatistics.builder()
                .rSquared(weightedAverage(fits.stream().mapToDouble(ModelFitStatistics::getRSquared).toArray(), weights))
                .mae(weightedAverage(fits.stream().mapToDouble(ModelFitStatistics::getMae).toArray(), weights))
                .mape(weightedAverage(fits.stream().mapToDouble(ModelFitStatistics::getMape).toArray(), weights))
                .rmse(weightedAverage(fits.stream().mapToDouble(ModelFitStatistics::getRmse).toArray(), weights))
                .dataPointsUsed(dataPointsUsed)
                .build();
    }

    // ============= VALIDATION =============

    private void validateConfig(ForecastConfig config) {
        String method = config.getMethod();
        if (method == null || method.isBlank()) {
            throw new InvalidForecastConfigException("Forecast method is required");
        }
        if (!ENSEMBLE.equals(method) && !strategies.containsKey(method)) {
            List<String> available = new ArrayList<>(strategies.keySet());
            available.add(ENSEMBLE);
            throw new UnknownForecastMethodException(method, available);
        }
        if (config.getForecastPeriods() <= 0) {
            throw new InvalidForecastConfigException("forecastPeriods must be positive, got " + config.getForecastPeriods());
        }
        if (!(config.getConfidenceLevel() > 0 && config.getConfidenceLevel() < 1)) {
            throw new InvalidForecastConfigException("confidenceLevel must be between 0 and 1, got " + config.getConfidenceLevel());
        }
        if (!(config.getSmoothingAlpha() > 0 && config.getSmoothingAlpha() < 1)) {
            throw new InvalidForecastConfigException("smoothingAlpha must be between 0 and 1, got " + config.getSmoothingAlpha());
        }
        if (config.getMovingAverageWindow() < 1) {
            throw new InvalidForecastConfigException("movingAverageWindow must be at least 1, got " + config.getMovingAverageWindow());
        }
        if (config.getMinDataPoints() < 1) {
            throw new InvalidForecastConfigException("minDataPoints must be at least 1, got " + config.getMinDataPoints());
        }
    }

    private void validateInput(HistoricalRevenueInput input, ForecastConfig config) {
        int size = input.getDataPoints().size();
        if (size < config.getMinDataPoints()) {
            throw new InsufficientDataException(config.getMinDataPoints(), size);
        }
        for (HistoricalRevenuePoint point : input.getDataPoints()) {
            if (point.getDate() == null) {
                throw new InvalidRevenueDataException("Every revenue data point needs a date");
            }
            if (point.getRevenue() < 0 || Double.isNaN(point.getRevenue())) {
                throw new InvalidRevenueDataException("Revenue values cannot be negative (" + point.getDate() + ")");
            }
        }
    }

    // ============= TREND & CONFIDENCE =============

    /**
     * Trend of the raw series, independent of the forecasting method. Growth is the OLS
     * slope relative to the mean; volatility is the coefficient of variation, both in %.
     */
    static TrendAnalysis analyzeTrend(double[] values) {
        int n = values.length;
        if (n < 2) {
            return TrendAnalysis.flat();
        }

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumX2 += (double) i * i;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
        double meanY = sumY / n;

        double monthlyGrowthRate = meanY > 0 ? slope / meanY * 100 : 0;
        double annualizedGrowthRate = Math.pow(1 + monthlyGrowthRate / 100, 12) * 100 - 100;

        double variance = 0;
        for (double value : values) {
            variance += (value - meanY) * (value - meanY);
        }
        variance /= n;
        double volatility = meanY > 0 ? Math.sqrt(variance) / meanY * 100 : 0;

        RevenueTrend direction;
        if (volatility > VOLATILITY_THRESHOLD) {
            direction = RevenueTrend.VOLATILE;
        } else if (monthlyGrowthRate > GROWTH_THRESHOLD) {
            direction = RevenueTrend.GROWING;
        } else if (monthlyGrowthRate < -GROWTH_THRESHOLD) {
            direction = RevenueTrend.DECLINING;
        } else {
            direction = RevenueTrend.STABLE;
        }

        // heuristic, not a formal significance test
        boolean significant = Math.abs(monthlyGrowthRate) > volatility / Math.sqrt(n);

        return TrendAnalysis.builder()
                .direction(direction)
                .monthlyGrowthRate(roundToOneDecimal(monthlyGrowthRate))
                .annualizedGrowthRate(roundToOneDecimal(annualizedGrowthRate))
                .significant(significant)
                .volatility(roundToOneDecimal(volatility))
                .build();
    }

    static ForecastConfidenceLevel determineConfidenceLevel(ModelFitStatistics modelFit, int dataPoints) {
        if (modelFit.getRSquared() >= 0.8 && dataPoints >= 12) {
            return ForecastConfidenceLevel.HIGH;
        }
        if (modelFit.getRSquared() >= 0.6 && dataPoints >= 6) {
            return ForecastConfidenceLevel.MEDIUM;
        }
        return ForecastConfidenceLevel.LOW;
    }

    private static ForecastConfidenceInterval totalConfidenceInterval(List<ForecastedRevenuePoint> forecasts, double level) {
        double lower = 0;
        double upper = 0;
        for (ForecastedRevenuePoint forecast : forecasts) {
            lower += forecast.getConfidenceInterval().getLower();
            upper += forecast.getConfidenceInterval().getUpper();
        }
        return new ForecastConfidenceInterval(Math.round(lower), Math.round(upper), level);
    }

    // ============= NARRATIVE =============

    private static String generateSummary(long totalRevenue,
                                          TrendAnalysis trend,
                                          ForecastConfidenceLevel confidence,
                                          ForecastConfig config,
                                          String currency) {
        String trendText = switch (trend.getDirection()) {
            case GROWING -> "showing growth";
            case STABLE -> "remaining stable";
            case DECLINING -> "experiencing decline";
            case VOLATILE -> "highly variable";
        };
        String confidenceText = switch (confidence) {
            case HIGH -> "high confidence";
            case MEDIUM -> "moderate confidence";
            case LOW -> "low confidence (limited data)";
        };

        return String.format(Locale.US,
                "Forecasted revenue of %s %,d over %d %s, %s at %.1f%% annually. Prediction made with %s.",
                currency, totalRevenue, config.getForecastPeriods(), config.getGranularity().getPluralLabel(),
                trendText, Math.abs(trend.getAnnualizedGrowthRate()), confidenceText);
    }

    static List<String> generateRecommendedActions(TrendAnalysis trend,
                                                   ForecastConfidenceLevel confidence,
                                                   long totalRevenue) {
        List<String> actions = new ArrayList<>(switch (trend.getDirection()) {
            case GROWING -> List.of("maintain_current_strategies", "invest_in_capacity_expansion");
            case DECLINING -> List.of("review_marketing_effectiveness", "analyze_patient_retention",
                    "consider_promotional_campaigns");
            case STABLE -> List.of("optimize_operational_efficiency", "explore_new_service_offerings");
            case VOLATILE -> List.of("stabilize_revenue_streams", "diversify_patient_base",
                    "implement_recurring_revenue_programs");
        });

        if (trend.getDirection() == RevenueTrend.GROWING && trend.getAnnualizedGrowthRate() > 20) {
            actions.add("hire_additional_staff");
        }
        if (trend.getDirection() == RevenueTrend.DECLINING && trend.getAnnualizedGrowthRate() < -15) {
            actions.add("urgent_revenue_recovery_plan");
        }
        if (confidence == ForecastConfidenceLevel.LOW) {
            actions.add("improve_data_collection");
            actions.add("track_more_revenue_metrics");
        }
        if (totalRevenue > LARGE_REVENUE_THRESHOLD) {
            actions.add("consider_financial_planning_review");
        }
        return actions;
    }

    private static List<String> generateInsights(TrendAnalysis trend,
                                                 ForecastConfidenceLevel confidence,
                                                 ModelFitStatistics modelFit) {
        double rate = Math.abs(trend.getAnnualizedGrowthRate());
        List<String> insights = new ArrayList<>(switch (trend.getDirection()) {
            case GROWING -> List.of(String.format(Locale.US, "Revenue is growing at %.1f%% annually", rate));
            case DECLINING -> List.of(String.format(Locale.US, "Revenue is declining at %.1f%% annually", rate),
                    "Review marketing strategies and patient retention programs");
            case STABLE -> List.of("Revenue is stable with minimal fluctuation",
                    "Good time to invest in growth initiatives");
            case VOLATILE -> List.of("Revenue shows high volatility",
                    "Consider diversifying revenue streams for stability");
        });

        if (trend.getDirection() == RevenueTrend.GROWING && trend.getAnnualizedGrowthRate() > 20) {
            insights.add("Consider expanding capacity to meet increasing demand");
        }
        if (confidence == ForecastConfidenceLevel.LOW) {
            insights.add("Forecast confidence is low due to limited historical data");
        }
        if (modelFit.getRSquared() < 0.6) {
            insights.add("Model fit indicates irregular revenue patterns");
        }
        return insights;
    }
}
