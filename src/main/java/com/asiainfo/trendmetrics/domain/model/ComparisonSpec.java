package com.asiainfo.trendmetrics.domain.model;

/**
 * 周期对比定义
 *
 * @param strategy 对比方式
 * @param interval 回看的桶数 (同一粒度)，必须为正
 * @param alias    输出字段名，如 wow_change
 */
public record ComparisonSpec(ComparisonStrategy strategy, int interval, String alias) {

    public ComparisonSpec {
        if (strategy == null) {
            throw new IllegalArgumentException("Comparison strategy is required");
        }
        if (interval < 1) {
            throw new IllegalArgumentException("Comparison interval must be positive: " + interval);
        }
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Comparison alias is required");
        }
    }

    public static ComparisonSpec ratio(int interval, String alias) {
        return new ComparisonSpec(ComparisonStrategy.RATIO, interval, alias);
    }

    public static ComparisonSpec delta(int interval, String alias) {
        return new ComparisonSpec(ComparisonStrategy.DELTA, interval, alias);
    }
}
