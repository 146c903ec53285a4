package com.bmsedge.forecast.service.strategy;

import com.bmsedge.forecast.RevenueTestData;
import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinearRegressionStrategyTest {

    private final LinearRegressionStrategy strategy = new LinearRegressionStrategy();

    @Test
    @DisplayName("Should extend an exact trend line with increasing trend components")
    void testExactTrend() {
        double[] values = RevenueTestData.linear(12);
        ForecastConfig config = RevenueTestData.config("linear_regression", false);

        ForecastingStrategyResult result = strategy.calculate(RevenueTestData.monthly(values), values, config);

        List<ForecastedRevenuePoint> forecasts = result.getForecasts();
        for (int i = 0; i < forecasts.size(); i++) {
            assertEquals(2100 + 100 * (i + 1), forecasts.get(i).getPredicted());
            assertEquals(100.0 * (i + 1), forecasts.get(i).getTrendComponent(), 1e-9);
        }
        assertEquals(1.0, result.getModelFit().getRSquared(), 1e-9);
        assertEquals(Integer.valueOf(10), result.getModelFit().getDegreesOfFreedom());
    }

    @Test
    @DisplayName("Should widen the prediction interval further from the data")
    void testWideningIntervals() {
        double[] values = new double[12];
        for (int i = 0; i < values.length; i++) {
            values[i] = 1000 + 100 * i + (i % 2 == 0 ? 50 : -50);
        }
        ForecastConfig config = RevenueTestData.config("linear_regression", false);

        List<ForecastedRevenuePoint> forecasts = strategy
                .calculate(RevenueTestData.monthly(values), values, config).getForecasts();

        for (int i = 1; i < forecasts.size(); i++) {
            assertTrue(width(forecasts.get(i)) >= width(forecasts.get(i - 1)));
            assertTrue(forecasts.get(i).getTrendComponent() > forecasts.get(i - 1).getTrendComponent());
        }
        assertTrue(width(forecasts.get(5)) > width(forecasts.get(0)));
    }

    @Test
    @DisplayName("Should floor a steeply declining projection at zero")
    void testDecliningFloor() {
        double[] values = {6000, 5000, 4000, 3000, 2000, 1000};
        ForecastConfig config = RevenueTestData.config("linear_regression", false);

        List<ForecastedRevenuePoint> forecasts = strategy
                .calculate(RevenueTestData.monthly(values), values, config).getForecasts();

        assertEquals(0, forecasts.get(0).getPredicted());
        assertEquals(0, forecasts.get(5).getPredicted());
        for (ForecastedRevenuePoint point : forecasts) {
            assertTrue(point.getConfidenceInterval().getLower() >= 0);
        }
    }

    private static double width(ForecastedRevenuePoint point) {
        return point.getConfidenceInterval().getUpper() - point.getConfidenceInterval().getLower();
    }
}
