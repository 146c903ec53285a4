package com.bmsedge.forecast.dto;

import com.bmsedge.forecast.model.ForecastGranularity;
import com.bmsedge.forecast.model.HistoricalRevenueInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Revenue history of one clinic.
 */
@Setter
@Getter
public class RevenueHistoryRequest {

    @NotBlank(message = "Clinic id is required")
    private String clinicId;

    @NotEmpty(message = "At least one revenue data point is required")
    @Valid
    private List<RevenuePointRequest> dataPoints = new ArrayList<>();

    private ForecastGranularity granularity;

    private String currency;

    public HistoricalRevenueInput toInput() {
        return HistoricalRevenueInput.builder()
                .clinicId(clinicId)
                .dataPoints(dataPoints.stream().map(RevenuePointRequest::toPoint).collect(Collectors.toList()))
                .granularity(granularity)
                .currency(currency)
                .build();
    }
}
