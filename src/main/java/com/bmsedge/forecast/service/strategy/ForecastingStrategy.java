package com.bmsedge.forecast.service.strategy;

import com.bmsedge.forecast.model.ForecastConfig;
import com.bmsedge.forecast.model.HistoricalRevenuePoint;

import java.util.List;

/**
 * A forecasting algorithm. Implementations are stateless and deterministic, and degrade
 * to a best-effort result on numerically degenerate input instead of throwing.
 */
public interface ForecastingStrategy {

    /**
     * Registry key, also accepted as the {@code method} of a forecast request.
     */
    String getName();

    /**
     * @param historicalData chronologically sorted history
     * @param revenueValues  revenue of each history point, same order and length
     * @param config         validated configuration of the call
     */
    ForecastingStrategyResult calculate(List<HistoricalRevenuePoint> historicalData,
                                        double[] revenueValues,
                                        ForecastConfig config);
}
