package com.asiainfo.trendmetrics.domain.model;

import java.time.LocalDate;

/**
 * 聚合结果点，每个 (维度键, 时间桶) 一个
 */
public record MetricPoint(String metricName, DimensionKey dimensionKey, LocalDate bucketStart, double value) {

    public BucketKey key() {
        return new BucketKey(dimensionKey, bucketStart);
    }
}
