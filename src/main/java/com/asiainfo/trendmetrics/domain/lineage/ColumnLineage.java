package com.asiainfo.trendmetrics.domain.lineage;

import java.util.List;

/**
 * 报表输出列的血缘
 *
 * @param inputs     同一报表内直接依赖的输出列 (对比列依赖值列，标记列依赖条件字段)
 * @param sources    最终追溯到的源模型列，已去重
 * @param derivation 计算方式的可读描述，如 avg(row_count)
 */
public record ColumnLineage(
        String report,
        String column,
        Kind kind,
        List<String> inputs,
        List<SourceColumn> sources,
        String derivation
) {

    public enum Kind {
        DIMENSION,
        METRIC_DATE,
        VALUE,
        COMPARISON,
        FLAG
    }

    public ColumnLineage {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
