package com.bmsedge.forecast.dto;

import com.bmsedge.forecast.model.ForecastOverrides;
import jakarta.validation.Valid;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class ForecastRequest extends RevenueHistoryRequest {

    @Valid
    private ForecastOptionsRequest options;

    public ForecastOverrides toOverrides() {
        return options != null ? options.toOverrides() : ForecastOverrides.none();
    }
}
