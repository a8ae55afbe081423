package com.asiainfo.trendmetrics.domain.model;

import java.util.Locale;

/**
 * 指标聚合方式
 */
public enum CalculationMethod {
    AVERAGE,
    SUM,
    COUNT,
    MIN,
    MAX;

    public static CalculationMethod of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Calculation method must not be empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("AVG".equals(normalized)) {
            return AVERAGE;
        }
        try {
            return CalculationMethod.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown calculation method: " + value);
        }
    }
}
