package com.asiainfo.trendmetrics.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 带对比字段的指标点
 * comparisons: alias -> 对比值，无上期数据或上期为0时值为 null
 */
public record ComparedMetricPoint(
        String metricName,
        DimensionKey dimensionKey,
        LocalDate bucketStart,
        double value,
        Map<String, Double> comparisons
) {

    public ComparedMetricPoint {
        // Map.copyOf 不接受 null 值
        comparisons = comparisons == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(comparisons));
    }

    public static ComparedMetricPoint from(MetricPoint point, Map<String, Double> comparisons) {
        return new ComparedMetricPoint(point.metricName(), point.dimensionKey(), point.bucketStart(),
                point.value(), comparisons);
    }

    public Double comparison(String alias) {
        return comparisons.get(alias);
    }

    public BucketKey key() {
        return new BucketKey(dimensionKey, bucketStart);
    }
}
