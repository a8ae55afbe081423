package com.asiainfo.trendmetrics.domain.model;

import java.util.List;

/**
 * 单指标计算结果: 全部维度键的对比序列，按 (维度键, 时间桶) 升序
 */
public record MetricSeries(
        String metricName,
        Grain grain,
        List<String> dimensions,
        List<String> comparisonAliases,
        List<ComparedMetricPoint> points
) {

    public MetricSeries {
        dimensions = List.copyOf(dimensions);
        comparisonAliases = List.copyOf(comparisonAliases);
        points = List.copyOf(points);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
