package com.asiainfo.trendmetrics.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * 对齐后的分组: 同一 (维度键, 时间桶) 下的全部表达式取值
 */
public record AlignedGroup(DimensionKey dimensionKey, LocalDate bucketStart, List<Double> values) {

    public AlignedGroup {
        values = List.copyOf(values);
    }

    public BucketKey key() {
        return new BucketKey(dimensionKey, bucketStart);
    }
}
