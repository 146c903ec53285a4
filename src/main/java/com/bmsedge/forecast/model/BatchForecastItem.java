package com.bmsedge.forecast.model;

import lombok.Value;

/**
 * Outcome of one clinic in a batch: either a forecast or an error code and message.
 */
@Value
public class BatchForecastItem {
    String clinicId;
    RevenueForecastOutput forecast;
    String errorCode;
    String errorMessage;

    public static BatchForecastItem success(String clinicId, RevenueForecastOutput forecast) {
        return new BatchForecastItem(clinicId, forecast, null, null);
    }

    public static BatchForecastItem failure(String clinicId, String errorCode, String errorMessage) {
        return new BatchForecastItem(clinicId, null, errorCode, errorMessage);
    }

    public boolean isSuccess() {
        return forecast != null;
    }
}
