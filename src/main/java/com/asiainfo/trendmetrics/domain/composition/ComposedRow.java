package com.asiainfo.trendmetrics.domain.composition;

import com.asiainfo.trendmetrics.domain.model.DimensionKey;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 多指标关联后的一行
 * values: 指标值列与对比列 (对比列可为 null)
 * flags: 标记列
 */
public record ComposedRow(
        DimensionKey dimensionKey,
        LocalDate metricDate,
        Map<String, Double> values,
        Map<String, Boolean> flags
) {

    public ComposedRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public Double value(String column) {
        return values.get(column);
    }

    public boolean flag(String column) {
        return Boolean.TRUE.equals(flags.get(column));
    }
}
