package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
public class HistoricalRevenueInput {
    String clinicId;
    List<HistoricalRevenuePoint> dataPoints;
    ForecastGranularity granularity;
    String currency;

    @Builder
    public HistoricalRevenueInput(String clinicId, List<HistoricalRevenuePoint> dataPoints,
                                  ForecastGranularity granularity, String currency) {
        this.clinicId = clinicId;
        this.dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
        this.granularity = granularity == null ? ForecastGranularity.MONTHLY : granularity;
        this.currency = currency == null ? "EUR" : currency;
    }
}
