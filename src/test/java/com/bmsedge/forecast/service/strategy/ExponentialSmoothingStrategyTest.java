package com.bmsedge.forecast.service.strategy;

import com.bmsedge.forecast.RevenueTestData;
import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialSmoothingStrategyTest {

    private final ExponentialSmoothingStrategy strategy = new ExponentialSmoothingStrategy();

    @Test
    @DisplayName("Should track a perfectly linear series exactly")
    void testLinearSeries() {
        double[] values = RevenueTestData.linear(12);
        ForecastConfig config = RevenueTestData.config("exponential_smoothing", false);

        ForecastingStrategyResult result = strategy.calculate(RevenueTestData.monthly(values), values, config);

        List<ForecastedRevenuePoint> forecasts = result.getForecasts();
        for (int i = 0; i < forecasts.size(); i++) {
            assertEquals(2100 + 100 * (i + 1), forecasts.get(i).getPredicted());
            assertEquals(100.0 * (i + 1), forecasts.get(i).getTrendComponent(), 1e-9);
            assertEquals(forecasts.get(i).getPredicted(), forecasts.get(i).getConfidenceInterval().getUpper());
        }
        assertEquals(1.0, result.getModelFit().getRSquared(), 1e-9);
    }

    @Test
    @DisplayName("Should forecast a flat level when the trend is disabled")
    void testWithoutTrend() {
        double[] values = RevenueTestData.linear(12);
        ForecastConfig config = RevenueTestData.config("exponential_smoothing", false).toBuilder()
                .includeTrend(false)
                .build();

        ForecastingStrategyResult result = strategy.calculate(RevenueTestData.monthly(values), values, config);

        double first = result.getForecasts().get(0).getPredicted();
        for (ForecastedRevenuePoint point : result.getForecasts()) {
            assertEquals(first, point.getPredicted());
            assertEquals(0.0, point.getTrendComponent(), 1e-9);
        }
        // the level lags behind a rising series
        assertTrue(first < 2100);
        assertTrue(result.getModelFit().getRSquared() < 1.0);
    }

    @Test
    @DisplayName("Should react faster to recent values with a higher alpha")
    void testAlphaResponsiveness() {
        double[] values = {1000, 1000, 1000, 1000, 1000, 2000};
        ForecastConfig slow = RevenueTestData.config("exponential_smoothing", false).toBuilder()
                .includeTrend(false)
                .smoothingAlpha(0.1)
                .build();
        ForecastConfig fast = slow.toBuilder().smoothingAlpha(0.9).build();

        double slowForecast = strategy.calculate(RevenueTestData.monthly(values), values, slow)
                .getForecasts().get(0).getPredicted();
        double fastForecast = strategy.calculate(RevenueTestData.monthly(values), values, fast)
                .getForecasts().get(0).getPredicted();

        assertEquals(1100, slowForecast);
        assertEquals(1900, fastForecast);
    }

    @Test
    @DisplayName("Should widen the interval with the horizon for a noisy series")
    void testIntervalWidening() {
        double[] values = RevenueTestData.clinicRevenue();
        ForecastConfig config = RevenueTestData.config("exponential_smoothing", false);

        List<ForecastedRevenuePoint> forecasts = strategy
                .calculate(RevenueTestData.monthly(values), values, config).getForecasts();

        double firstWidth = forecasts.get(0).getConfidenceInterval().getUpper() - forecasts.get(0).getConfidenceInterval().getLower();
        double lastWidth = forecasts.get(5).getConfidenceInterval().getUpper() - forecasts.get(5).getConfidenceInterval().getLower();
        assertTrue(lastWidth > firstWidth);
    }
}
