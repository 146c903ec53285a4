package com.bmsedge.forecast.dto;

import com.bmsedge.forecast.model.HistoricalRevenuePoint;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Setter
@Getter
public class RevenuePointRequest {

    @NotNull(message = "Date is required")
    private LocalDate date;

    @NotNull(message = "Revenue is required")
    @PositiveOrZero(message = "Revenue cannot be negative")
    private Double revenue;

    @PositiveOrZero(message = "Cases completed cannot be negative")
    private Integer casesCompleted;

    @PositiveOrZero(message = "New patients cannot be negative")
    private Integer newPatients;

    private Double collectionRate;

    private Double avgCaseValue;

    private Double highValueRevenue;

    public RevenuePointRequest() {}

    public RevenuePointRequest(LocalDate date, Double revenue) {
        this.date = date;
        this.revenue = revenue;
    }

    public HistoricalRevenuePoint toPoint() {
        return HistoricalRevenuePoint.builder()
                .date(date)
                .revenue(revenue)
                .casesCompleted(casesCompleted != null ? casesCompleted : 0)
                .newPatients(newPatients != null ? newPatients : 0)
                .collectionRate(collectionRate)
                .avgCaseValue(avgCaseValue)
                .highValueRevenue(highValueRevenue)
                .build();
    }
}
