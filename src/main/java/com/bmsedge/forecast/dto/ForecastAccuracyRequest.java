package com.bmsedge.forecast.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Setter
@Getter
public class ForecastAccuracyRequest {

    @NotBlank(message = "Clinic id is required")
    private String clinicId;

    @NotNull(message = "Period start is required")
    private LocalDate periodStart;

    @NotNull(message = "Period end is required")
    private LocalDate periodEnd;

    @NotNull(message = "Forecasted revenue is required")
    @PositiveOrZero(message = "Forecasted revenue cannot be negative")
    private Double forecastedRevenue;

    @NotNull(message = "Actual revenue is required")
    @PositiveOrZero(message = "Actual revenue cannot be negative")
    private Double actualRevenue;

    @PositiveOrZero(message = "Interval lower bound cannot be negative")
    private Double intervalLower;

    @PositiveOrZero(message = "Interval upper bound cannot be negative")
    private Double intervalUpper;

    public ForecastAccuracyRequest() {}

    public ForecastAccuracyRequest(String clinicId, LocalDate periodStart, LocalDate periodEnd,
                                   Double forecastedRevenue, Double actualRevenue,
                                   Double intervalLower, Double intervalUpper) {
        this.clinicId = clinicId;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.forecastedRevenue = forecastedRevenue;
        this.actualRevenue = actualRevenue;
        this.intervalLower = intervalLower;
        this.intervalUpper = intervalUpper;
    }
}
