package com.costtelemetry.domain.model;

/**
 * Algorithm label requested for a forecast.
 *
 * All labels are served by the same trend extrapolation; the method actually
 * applied is recorded on the prediction as {@code computationMethod}.
 */
public enum ForecastAlgorithm {
    LINEAR_REGRESSION,
    ARIMA,
    PROPHET,
    LSTM,
    ENSEMBLE;

    public String key() {
        return name().toLowerCase();
    }
}
