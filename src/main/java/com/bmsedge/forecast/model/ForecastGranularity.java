package com.bmsedge.forecast.model;

import java.time.LocalDate;

public enum ForecastGranularity {
    DAILY("days") {
        @Override
        public LocalDate advance(LocalDate date, long periods) {
            return date.plusDays(periods);
        }
    },
    WEEKLY("weeks") {
        @Override
        public LocalDate advance(LocalDate date, long periods) {
            return date.plusWeeks(periods);
        }
    },
    MONTHLY("months") {
        @Override
        public LocalDate advance(LocalDate date, long periods) {
            return date.plusMonths(periods);
        }
    },
    QUARTERLY("quarters") {
        @Override
        public LocalDate advance(LocalDate date, long periods) {
            return date.plusMonths(3 * periods);
        }
    };

    private final String pluralLabel;

    ForecastGranularity(String pluralLabel) {
        this.pluralLabel = pluralLabel;
    }

    /**
     * Moves {@code date} forward by the given number of periods of this granularity.
     */
    public abstract LocalDate advance(LocalDate date, long periods);

    public String getPluralLabel() {
        return pluralLabel;
    }
}
