package com.costtelemetry.domain.model;

import java.time.LocalDateTime;

/**
 * Calendar period shared by budgets and forecasts.
 *
 * The day multiplier scales an average daily cost to the period; the
 * calendar advance moves a budget window forward on auto-reset.
 */
public enum CostPeriod {
    DAILY(1, ForecastHorizon.SHORT_TERM),
    WEEKLY(7, ForecastHorizon.SHORT_TERM),
    MONTHLY(30, ForecastHorizon.MEDIUM_TERM),
    QUARTERLY(90, ForecastHorizon.LONG_TERM),
    YEARLY(365, ForecastHorizon.LONG_TERM);

    private final int days;
    private final ForecastHorizon horizon;

    CostPeriod(int days, ForecastHorizon horizon) {
        this.days = days;
        this.horizon = horizon;
    }

    public int getDays() {
        return days;
    }

    public ForecastHorizon getHorizon() {
        return horizon;
    }

    public String key() {
        return name().toLowerCase();
    }

    /**
     * Next window boundary after {@code from}, following calendar months and years.
     */
    public LocalDateTime advance(LocalDateTime from) {
        return switch (this) {
            case DAILY -> from.plusDays(1);
            case WEEKLY -> from.plusWeeks(1);
            case MONTHLY -> from.plusMonths(1);
            case QUARTERLY -> from.plusMonths(3);
            case YEARLY -> from.plusYears(1);
        };
    }
}
