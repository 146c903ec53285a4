package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchForecastResult {
    int total;
    int succeeded;
    int failed;
    @Singular
    List<BatchForecastItem> results;
    AggregateStats aggregateStats;
    long durationMs;

    @Value
    public static class AggregateStats {
        long totalPredictedRevenue;
        double averageGrowthRate;
        int growingClinics;
        int decliningClinics;
    }
}
