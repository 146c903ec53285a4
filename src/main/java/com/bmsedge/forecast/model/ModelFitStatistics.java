package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Goodness of fit of the in-sample fitted values against the actual series.
 */
@Value
@Builder(toBuilder = true)
public class ModelFitStatistics {
    @JsonProperty("rSquared")
    double rSquared;
    double mae;
    double mape;
    double rmse;
    Double aic;
    int dataPointsUsed;
    Integer degreesOfFreedom;
}
