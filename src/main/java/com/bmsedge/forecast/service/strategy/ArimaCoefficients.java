package com.bmsedge.forecast.service.strategy;

import lombok.Value;

/**
 * Fitted ARIMA coefficients on the differenced scale.
 */
@Value
public class ArimaCoefficients {
    double[] ar;
    double[] ma;
    double constant;
    /** residual variance */
    double sigma2;
}
