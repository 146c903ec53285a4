package com.bmsedge.forecast.service.strategy;

import com.bmsedge.forecast.model.ForecastedRevenuePoint;
import com.bmsedge.forecast.model.ModelFitStatistics;
import lombok.Value;

import java.util.List;

@Value
public class ForecastingStrategyResult {
    List<ForecastedRevenuePoint> forecasts;
    ModelFitStatistics modelFit;

    public ForecastingStrategyResult(List<ForecastedRevenuePoint> forecasts, ModelFitStatistics modelFit) {
        this.forecasts = List.copyOf(forecasts);
        this.modelFit = modelFit;
    }
}
