package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrendAnalysis {
    RevenueTrend direction;
    double monthlyGrowthRate;
    double annualizedGrowthRate;
    @JsonProperty("isSignificant")
    boolean significant;
    double volatility;

    public static TrendAnalysis flat() {
        return TrendAnalysis.builder()
                .direction(RevenueTrend.STABLE)
                .build();
    }
}
