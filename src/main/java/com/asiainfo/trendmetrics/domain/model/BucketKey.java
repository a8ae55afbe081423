package com.asiainfo.trendmetrics.domain.model;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * (维度键, 时间桶) 组合，分组与多指标关联的键
 */
public record BucketKey(DimensionKey dimensionKey, LocalDate bucketStart) implements Comparable<BucketKey> {

    private static final Comparator<BucketKey> ORDER = Comparator
            .comparing(BucketKey::dimensionKey)
            .thenComparing(BucketKey::bucketStart);

    @Override
    public int compareTo(BucketKey other) {
        return ORDER.compare(this, other);
    }
}
