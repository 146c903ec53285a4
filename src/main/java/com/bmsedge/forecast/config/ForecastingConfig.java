package com.bmsedge.forecast.config;

import com.bmsedge.forecast.service.ForecastAccuracyService;
import com.bmsedge.forecast.service.RevenueForecastingService;
import com.bmsedge.forecast.service.RevenueForecastingServiceConfig;
import com.bmsedge.forecast.service.strategy.ArimaStrategy;
import com.bmsedge.forecast.service.strategy.ExponentialSmoothingStrategy;
import com.bmsedge.forecast.service.strategy.ForecastingStrategy;
import com.bmsedge.forecast.service.strategy.LinearRegressionStrategy;
import com.bmsedge.forecast.service.strategy.MovingAverageStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class ForecastingConfig {

    @Value("${forecasting.default-method:ensemble}")
    private String defaultMethod;

    @Value("${forecasting.default-forecast-periods:6}")
    private int defaultForecastPeriods;

    @Value("${forecasting.default-confidence-level:0.95}")
    private double defaultConfidenceLevel;

    @Value("${forecasting.default-moving-average-window:3}")
    private int defaultMovingAverageWindow;

    @Value("${forecasting.default-smoothing-alpha:0.3}")
    private double defaultSmoothingAlpha;

    @Value("${forecasting.min-data-points:6}")
    private int minDataPoints;

    @Value("${forecasting.model-version:2.0.0}")
    private String modelVersion;

    @Value("${forecasting.ensemble-parallel:false}")
    private boolean ensembleParallel;

    @Value("${forecasting.recalibration-threshold:25}")
    private double recalibrationThreshold;

    @Bean
    public Clock forecastingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MovingAverageStrategy movingAverageStrategy() {
        return new MovingAverageStrategy();
    }

    @Bean
    public ExponentialSmoothingStrategy exponentialSmoothingStrategy() {
        return new ExponentialSmoothingStrategy();
    }

    @Bean
    public LinearRegressionStrategy linearRegressionStrategy() {
        return new LinearRegressionStrategy();
    }

    @Bean
    public ArimaStrategy arimaStrategy() {
        return new ArimaStrategy();
    }

    /**
     * Every {@link ForecastingStrategy} bean in the context takes part in dispatch and ensemble.
     */
    @Bean
    public RevenueForecastingService revenueForecastingService(List<ForecastingStrategy> strategies, Clock clock) {
        RevenueForecastingServiceConfig config = RevenueForecastingServiceConfig.builder()
                .defaultMethod(defaultMethod)
                .defaultForecastPeriods(defaultForecastPeriods)
                .defaultConfidenceLevel(defaultConfidenceLevel)
                .defaultMovingAverageWindow(defaultMovingAverageWindow)
                .defaultSmoothingAlpha(defaultSmoothingAlpha)
                .minDataPoints(minDataPoints)
                .modelVersion(modelVersion)
                .parallelEnsemble(ensembleParallel)
                .strategies(strategies)
                .build();
        return new RevenueForecastingService(config, clock);
    }

    @Bean
    public ForecastAccuracyService forecastAccuracyService() {
        return new ForecastAccuracyService(recalibrationThreshold);
    }
}
