package com.asiainfo.trendmetrics.domain.composition;

import com.asiainfo.trendmetrics.shared.MetricsConstants;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 输出表
 * 列顺序: 维度列, metric_date, 每个指标的值列及其对比列 (列名可由报表重命名), 标记列
 * 行顺序: metric_date 降序, 再按报表 order_by (默认维度声明顺序) 升序
 */
public record MetricTable(
        List<String> dimensions,
        List<String> valueColumns,
        List<String> flagColumns,
        List<ComposedRow> rows
) {

    public MetricTable {
        dimensions = List.copyOf(dimensions);
        valueColumns = List.copyOf(valueColumns);
        flagColumns = List.copyOf(flagColumns);
        rows = List.copyOf(rows);
    }

    public static MetricTable empty(List<String> dimensions, List<String> valueColumns, List<String> flagColumns) {
        return new MetricTable(dimensions, valueColumns, flagColumns, List.of());
    }

    public List<String> columns() {
        List<String> columns = new ArrayList<>(dimensions);
        columns.add(MetricsConstants.METRIC_DATE);
        columns.addAll(valueColumns);
        columns.addAll(flagColumns);
        return columns;
    }

    public int size() {
        return rows.size();
    }

    /**
     * 展开为列名 -> 值的扁平行，便于下游落表
     */
    public List<Map<String, Object>> toRows() {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (ComposedRow row : rows) {
            Map<String, Object> flat = new LinkedHashMap<>();
            for (int i = 0; i < dimensions.size(); i++) {
                flat.put(dimensions.get(i), row.dimensionKey().get(i));
            }
            flat.put(MetricsConstants.METRIC_DATE, row.metricDate());
            for (String column : valueColumns) {
                flat.put(column, row.value(column));
            }
            for (String column : flagColumns) {
                flat.put(column, row.flag(column));
            }
            result.add(flat);
        }
        return result;
    }
}
