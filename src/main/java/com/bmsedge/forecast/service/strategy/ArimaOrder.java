package com.bmsedge.forecast.service.strategy;

import lombok.Value;

/**
 * Non-seasonal ARIMA(p, d, q) order.
 */
@Value(staticConstructor = "of")
public class ArimaOrder {
    int p;
    int d;
    int q;

    /**
     * Number of estimated parameters: AR and MA coefficients plus the constant.
     */
    public int parameterCount() {
        return p + q + 1;
    }

    @Override
    public String toString() {
        return "ARIMA(" + p + "," + d + "," + q + ")";
    }
}
