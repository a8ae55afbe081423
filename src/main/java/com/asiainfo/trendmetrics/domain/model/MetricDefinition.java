package com.asiainfo.trendmetrics.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 指标定义
 * 注册后不可变，集合字段在构造时做防御性拷贝
 */
public record MetricDefinition(
        String name,
        String label,
        String description,
        String source,               // 源表引用，如 table_metadata_snapshot
        CalculationMethod calculationMethod,
        String expression,           // 被聚合的列或派生表达式
        String timestampField,
        Set<Grain> allowedGrains,
        List<String> dimensions      // 有序的维度列
) {

    public MetricDefinition {
        allowedGrains = allowedGrains == null || allowedGrains.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(allowedGrains));
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    /**
     * 精简工厂，label/description 留空
     */
    public static MetricDefinition of(String name, String source, CalculationMethod method, String expression,
            String timestampField, Set<Grain> allowedGrains, List<String> dimensions) {
        return new MetricDefinition(name, null, null, source, method, expression, timestampField,
                allowedGrains, dimensions);
    }

    public boolean supports(Grain grain) {
        return allowedGrains.contains(grain);
    }
}
