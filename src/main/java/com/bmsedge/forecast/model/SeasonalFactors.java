package com.bmsedge.forecast.model;

import java.time.Month;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Multiplicative month-of-year adjustment table. Months absent from a custom table are
 * neutral (1.0).
 */
public final class SeasonalFactors {

    private static final SeasonalFactors DEFAULTS;

    static {
        Map<Month, Double> factors = new EnumMap<>(Month.class);
        // Q1 post-holiday recovery, Q2 cosmetic peak, Q3 summer slowdown, Q4 pre-holiday peak
        factors.put(Month.JANUARY, 0.85);
        factors.put(Month.FEBRUARY, 0.90);
        factors.put(Month.MARCH, 1.05);
        factors.put(Month.APRIL, 1.10);
        factors.put(Month.MAY, 1.15);
        factors.put(Month.JUNE, 1.05);
        factors.put(Month.JULY, 0.85);
        factors.put(Month.AUGUST, 0.80);
        factors.put(Month.SEPTEMBER, 1.05);
        factors.put(Month.OCTOBER, 1.10);
        factors.put(Month.NOVEMBER, 1.10);
        factors.put(Month.DECEMBER, 0.95);
        DEFAULTS = new SeasonalFactors(factors);
    }

    private final Map<Month, Double> factors;

    private SeasonalFactors(Map<Month, Double> factors) {
        Map<Month, Double> copy = new EnumMap<>(Month.class);
        copy.putAll(factors);
        this.factors = Collections.unmodifiableMap(copy);
    }

    public static SeasonalFactors defaults() {
        return DEFAULTS;
    }

    public static SeasonalFactors of(Map<Month, Double> factors) {
        Objects.requireNonNull(factors, "factors");
        return new SeasonalFactors(factors);
    }

    /**
     * Same factor for every month.
     */
    public static SeasonalFactors uniform(double factor) {
        Map<Month, Double> factors = new EnumMap<>(Month.class);
        for (Month month : Month.values()) {
            factors.put(month, factor);
        }
        return new SeasonalFactors(factors);
    }

    public double factorFor(Month month) {
        return factors.getOrDefault(month, 1.0);
    }

    public Map<Month, Double> asMap() {
        return factors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeasonalFactors)) return false;
        return factors.equals(((SeasonalFactors) o).factors);
    }

    @Override
    public int hashCode() {
        return factors.hashCode();
    }

    @Override
    public String toString() {
        return "SeasonalFactors" + factors;
    }
}
