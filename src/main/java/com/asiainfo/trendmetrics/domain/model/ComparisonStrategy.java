package com.asiainfo.trendmetrics.domain.model;

import java.util.Locale;

/**
 * 同比/环比计算方式
 * RATIO: current / prior
 * DELTA: current - prior
 */
public enum ComparisonStrategy {
    RATIO,
    DELTA;

    public static ComparisonStrategy of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Comparison strategy must not be empty");
        }
        try {
            return ComparisonStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown comparison strategy: " + value);
        }
    }
}
