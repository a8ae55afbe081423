package com.asiainfo.trendmetrics.domain.model;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 单指标计算请求
 */
public record MetricRequest(
        String metricName,
        Grain grain,
        List<String> dimensions,          // 为空时使用指标定义的全部维度
        List<ComparisonSpec> comparisons, // 周期对比，可为空
        LocalDate startDate,              // 源数据窗口起点 (含)，可为 null
        LocalDate endDate                 // 源数据窗口终点 (不含)，可为 null
) {

    public MetricRequest {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("Metric name is required");
        }
        if (grain == null) {
            throw new IllegalArgumentException("Grain is required for metric " + metricName);
        }
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
        Set<String> aliases = new HashSet<>();
        for (ComparisonSpec spec : comparisons) {
            if (!aliases.add(spec.alias())) {
                throw new IllegalArgumentException("Duplicate comparison alias '" + spec.alias()
                        + "' for metric " + metricName);
            }
        }
        if (startDate != null && endDate != null && !startDate.isBefore(endDate)) {
            throw new IllegalArgumentException("Window start " + startDate + " must be before end " + endDate);
        }
    }

    public static MetricRequest of(String metricName, Grain grain, List<String> dimensions,
            List<ComparisonSpec> comparisons) {
        return new MetricRequest(metricName, grain, dimensions, comparisons, null, null);
    }

    public MetricRequest withWindow(LocalDate start, LocalDate end) {
        return new MetricRequest(metricName, grain, dimensions, comparisons, start, end);
    }
}
