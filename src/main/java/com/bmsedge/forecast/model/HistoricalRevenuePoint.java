package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Aggregated revenue of one period, as supplied by the caller.
 */
@Value
@Builder
public class HistoricalRevenuePoint {
    LocalDate date;
    double revenue;
    int casesCompleted;
    int newPatients;
    Double collectionRate;
    Double avgCaseValue;
    Double highValueRevenue;

    public static HistoricalRevenuePoint of(LocalDate date, double revenue) {
        return HistoricalRevenuePoint.builder()
                .date(date)
                .revenue(revenue)
                .build();
    }
}
