package com.bmsedge.forecast.util;

import com.bmsedge.forecast.RevenueTestData;
import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.ForecastGranularity;
import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import com.bmsedge.forecast.model.ModelFitStatistics;
import com.bmsedge.forecast.model.SeasonalFactors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ForecastingUtilsTest {

    @Test
    @DisplayName("Should return the z-score of the nearest tabulated confidence level")
    void testZScore() {
        assertEquals(1.960, ForecastingUtils.zScore(0.95), 1e-9);
        assertEquals(2.576, ForecastingUtils.zScore(0.99), 1e-9);
        assertEquals(1.960, ForecastingUtils.zScore(0.94), 1e-9);
        assertEquals(1.282, ForecastingUtils.zScore(0.5), 1e-9);
    }

    @Test
    @DisplayName("Should look up seasonal factors by month and ignore them when seasonality is off")
    void testSeasonalFactor() {
        LocalDate may = LocalDate.of(2025, 5, 1);
        assertEquals(1.15, ForecastingUtils.seasonalFactor(may, SeasonalFactors.defaults()), 1e-9);
        assertEquals(0.85, ForecastingUtils.seasonalFactor(LocalDate.of(2025, 1, 15), (SeasonalFactors) null), 1e-9);

        SeasonalFactors custom = SeasonalFactors.of(Map.of(Month.MAY, 2.0));
        assertEquals(2.0, ForecastingUtils.seasonalFactor(may, custom), 1e-9);
        assertEquals(1.0, ForecastingUtils.seasonalFactor(LocalDate.of(2025, 6, 1), custom), 1e-9);

        ForecastConfig noSeasonality = RevenueTestData.config("moving_average", false);
        assertEquals(1.0, ForecastingUtils.seasonalFactor(may, noSeasonality), 1e-9);
    }

    @Test
    @DisplayName("Should report a perfect fit for identical series")
    void testModelFitPerfect() {
        double[] actual = {100, 200, 300, 400};

        ModelFitStatistics fit = ForecastingUtils.calculateModelFit(actual, actual.clone());

        assertEquals(1.0, fit.getRSquared(), 1e-9);
        assertEquals(0.0, fit.getMae(), 1e-9);
        assertEquals(0.0, fit.getMape(), 1e-9);
        assertEquals(0.0, fit.getRmse(), 1e-9);
        assertEquals(4, fit.getDataPointsUsed());
    }

    @Test
    @DisplayName("Should clamp R-squared to zero for constant or badly fitted series")
    void testModelFitClamped() {
        ModelFitStatistics constant = ForecastingUtils.calculateModelFit(
                new double[] {500, 500, 500}, new double[] {400, 500, 600});
        assertEquals(0.0, constant.getRSquared(), 1e-9);

        ModelFitStatistics poor = ForecastingUtils.calculateModelFit(
                new double[] {100, 200, 300}, new double[] {300, 200, 100});
        assertEquals(0.0, poor.getRSquared(), 1e-9);
        assertEquals(400.0 / 3, poor.getMae(), 1e-9);
    }

    @Test
    @DisplayName("Should skip zero actuals when computing MAPE")
    void testMapeSkipsZeroActuals() {
        ModelFitStatistics fit = ForecastingUtils.calculateModelFit(
                new double[] {0, 100, 200}, new double[] {10, 110, 180});

        assertEquals(10.0, fit.getMape(), 1e-9);
    }

    @Test
    @DisplayName("Should date forecast points one granularity unit after the last observation")
    void testGenerateForecastPointDates() {
        ForecastConfig quarterly = RevenueTestData.config("moving_average", false).toBuilder()
                .granularity(ForecastGranularity.QUARTERLY)
                .forecastPeriods(3)
                .build();

        List<ForecastedRevenuePoint> points = ForecastingUtils.generateForecastPoints(
                RevenueTestData.monthly(1, 2, 3), quarterly,
                (i, date) -> ForecastingUtils.forecastPoint(date, i, 100, 10, quarterly, null, null));

        assertEquals(3, points.size());
        assertEquals(LocalDate.of(2024, 6, 1), points.get(0).getDate());
        assertEquals(LocalDate.of(2024, 9, 1), points.get(1).getDate());
        assertEquals(LocalDate.of(2024, 12, 1), points.get(2).getDate());
    }

    @Test
    @DisplayName("Should floor negative predictions at zero and keep the interval ordered")
    void testForecastPointFloorsAtZero() {
        ForecastConfig config = RevenueTestData.config("moving_average", false);

        ForecastedRevenuePoint negative = ForecastingUtils.forecastPoint(
                LocalDate.of(2025, 1, 1), 0, -500, 200, config, null, null);
        assertEquals(0, negative.getPredicted());
        assertEquals(0, negative.getConfidenceInterval().getLower());
        assertEquals(200, negative.getConfidenceInterval().getUpper());

        ForecastedRevenuePoint normal = ForecastingUtils.forecastPoint(
                LocalDate.of(2025, 1, 1), 0, 1000.4, 99.6, config, 1.0, 5.0);
        assertEquals(1000, normal.getPredicted());
        assertEquals(901, normal.getConfidenceInterval().getLower());
        assertEquals(1100, normal.getConfidenceInterval().getUpper());
        assertEquals(0.95, normal.getConfidenceInterval().getLevel(), 1e-9);

        ForecastedRevenuePoint nan = ForecastingUtils.forecastPoint(
                LocalDate.of(2025, 1, 1), 0, Double.NaN, Double.NaN, config, null, null);
        assertEquals(0, nan.getPredicted());
        assertEquals(0, nan.getConfidenceInterval().getUpper());
    }

    @Test
    @DisplayName("Should flag the second half of the horizon as high uncertainty")
    void testHighUncertainty() {
        assertFalse(ForecastingUtils.isHighUncertainty(0, 6));
        assertFalse(ForecastingUtils.isHighUncertainty(2, 6));
        assertTrue(ForecastingUtils.isHighUncertainty(3, 6));
        assertFalse(ForecastingUtils.isHighUncertainty(2, 5));
        assertTrue(ForecastingUtils.isHighUncertainty(3, 5));
        assertFalse(ForecastingUtils.isHighUncertainty(0, 1));
    }

    @Test
    @DisplayName("Should compute means and sample standard deviations over ranges")
    void testMeanAndStandardDeviation() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertEquals(5.0, ForecastingUtils.mean(values), 1e-9);
        assertEquals(6.0, ForecastingUtils.mean(values, 5, 7), 1e-9);
        assertEquals(0.0, ForecastingUtils.mean(values, 3, 3), 1e-9);
        assertEquals(Math.sqrt(32.0 / 7), ForecastingUtils.sampleStandardDeviation(values, 0, 8), 1e-9);
        assertEquals(0.0, ForecastingUtils.sampleStandardDeviation(values, 0, 1), 1e-9);
    }
}
