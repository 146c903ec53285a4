package com.bmsedge.forecast.dto;

import com.bmsedge.forecast.model.ForecastOverrides;
import com.bmsedge.forecast.model.HistoricalRevenueInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Setter
@Getter
public class BatchForecastRequest {

    @NotEmpty(message = "At least one clinic is required")
    @Valid
    private List<RevenueHistoryRequest> clinics = new ArrayList<>();

    @Valid
    private ForecastOptionsRequest options;

    private boolean continueOnError = true;

    public List<HistoricalRevenueInput> toInputs() {
        return clinics.stream().map(RevenueHistoryRequest::toInput).collect(Collectors.toList());
    }

    public ForecastOverrides toOverrides() {
        return options != null ? options.toOverrides() : ForecastOverrides.none();
    }
}
