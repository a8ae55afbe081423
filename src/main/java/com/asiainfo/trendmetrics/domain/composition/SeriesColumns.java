package com.asiainfo.trendmetrics.domain.composition;

import com.asiainfo.trendmetrics.domain.model.MetricSeries;
import com.asiainfo.trendmetrics.shared.MetricsConstants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个指标序列在输出表中的列名
 * valueColumn: 指标值列; comparisonColumns: alias -> 对比列
 */
public record SeriesColumns(String valueColumn, Map<String, String> comparisonColumns) {

    public SeriesColumns {
        if (valueColumn == null || valueColumn.isBlank()) {
            throw new IllegalArgumentException("Value column name is required");
        }
        comparisonColumns = comparisonColumns == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(comparisonColumns));
    }

    /**
     * 默认命名: {@code <metric>} 与 {@code <metric>_<alias>}
     */
    public static SeriesColumns defaults(MetricSeries series) {
        Map<String, String> byAlias = new LinkedHashMap<>();
        for (String alias : series.comparisonAliases()) {
            byAlias.put(alias, MetricsConstants.comparisonColumn(series.metricName(), alias));
        }
        return new SeriesColumns(series.metricName(), byAlias);
    }

    public String comparisonColumn(String alias) {
        String column = comparisonColumns.get(alias);
        if (column == null) {
            throw new IllegalArgumentException("No output column for comparison " + alias + " of " + valueColumn);
        }
        return column;
    }
}
