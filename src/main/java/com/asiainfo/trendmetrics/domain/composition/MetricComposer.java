package com.asiainfo.trendmetrics.domain.composition;

import com.asiainfo.trendmetrics.domain.model.BucketKey;
import com.asiainfo.trendmetrics.domain.model.ComparedMetricPoint;
import com.asiainfo.trendmetrics.domain.model.MetricSeries;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 多指标关联与标记
 *
 * 按 (维度键, 时间桶) 内连接：只在部分序列中出现的组合被丢弃 (有损关联)，丢弃数量写日志。
 * 标记规则只读取关联行上已计算好的字段，不会回头触发聚合。
 */
@ApplicationScoped
public class MetricComposer {

    private static final Logger log = LoggerFactory.getLogger(MetricComposer.class);

    @ConfigProperty(name = "metrics.composition.warn-on-dropped-rows", defaultValue = "true")
    boolean warnOnDroppedRows;

    /**
     * 默认列名、按维度声明顺序排序
     */
    public MetricTable compose(List<MetricSeries> seriesList, List<FlagRule> rules) {
        if (seriesList == null || seriesList.isEmpty()) {
            throw new IllegalArgumentException("At least one metric series is required");
        }
        return compose(seriesList, seriesList.stream().map(SeriesColumns::defaults).toList(), rules, List.of());
    }

    /**
     * @param columns 与 seriesList 一一对应的输出列名
     * @param orderBy 同一 metric_date 内的维度排序列，为空时按维度声明顺序
     */
    public MetricTable compose(List<MetricSeries> seriesList, List<SeriesColumns> columns, List<FlagRule> rules,
            List<String> orderBy) {
        if (seriesList == null || seriesList.isEmpty()) {
            throw new IllegalArgumentException("At least one metric series is required");
        }
        if (columns == null || columns.size() != seriesList.size()) {
            throw new IllegalArgumentException("Expected " + seriesList.size() + " column mapping(s), got "
                    + (columns == null ? 0 : columns.size()));
        }
        List<FlagRule> flagRules = rules == null ? List.of() : rules;

        List<String> dims = seriesList.get(0).dimensions();
        List<String> valueColumns = valueColumns(seriesList, columns);
        List<String> flagColumns = flagColumns(flagRules, valueColumns);
        Comparator<ComposedRow> order = outputOrder(dims, orderBy == null ? List.of() : orderBy);

        for (MetricSeries series : seriesList) {
            if (!series.dimensions().equals(dims)) {
                log.warn("Dimension mismatch: {} has {} but {} has {}, join produces no rows",
                        seriesList.get(0).metricName(), dims, series.metricName(), series.dimensions());
                return MetricTable.empty(dims, valueColumns, flagColumns);
            }
        }

        // 1. 建索引
        List<Map<BucketKey, ComparedMetricPoint>> indexes = new ArrayList<>(seriesList.size());
        Set<BucketKey> allKeys = new HashSet<>();
        for (MetricSeries series : seriesList) {
            Map<BucketKey, ComparedMetricPoint> index = new HashMap<>(series.points().size() * 2);
            for (ComparedMetricPoint p : series.points()) {
                index.put(p.key(), p);
            }
            indexes.add(index);
            allKeys.addAll(index.keySet());
        }

        // 2. 内连接
        List<ComposedRow> rows = new ArrayList<>();
        for (BucketKey key : indexes.get(0).keySet()) {
            if (!presentInAll(key, indexes)) {
                continue;
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (int i = 0; i < seriesList.size(); i++) {
                MetricSeries series = seriesList.get(i);
                SeriesColumns names = columns.get(i);
                ComparedMetricPoint p = indexes.get(i).get(key);
                values.put(names.valueColumn(), p.value());
                for (String alias : series.comparisonAliases()) {
                    values.put(names.comparisonColumn(alias), p.comparison(alias));
                }
            }
            rows.add(new ComposedRow(key.dimensionKey(), key.bucketStart(), values, evaluateFlags(flagRules, values)));
        }

        int dropped = allKeys.size() - rows.size();
        if (dropped > 0) {
            if (warnOnDroppedRows) {
                log.warn("Inner join dropped {} of {} (dimension, bucket) combination(s) missing from at least one of {}",
                        dropped, allKeys.size(), seriesList.stream().map(MetricSeries::metricName).toList());
            } else {
                log.debug("Inner join dropped {} of {} combination(s)", dropped, allKeys.size());
            }
        }

        // 3. 排序: metric_date 降序, 维度升序
        rows.sort(order);
        return new MetricTable(dims, valueColumns, flagColumns, rows);
    }

    private static boolean presentInAll(BucketKey key, List<Map<BucketKey, ComparedMetricPoint>> indexes) {
        for (Map<BucketKey, ComparedMetricPoint> index : indexes) {
            if (!index.containsKey(key)) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Boolean> evaluateFlags(List<FlagRule> rules, Map<String, Double> values) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (FlagRule rule : rules) {
            flags.put(rule.outputField(), rule.condition().test(values));
        }
        return flags;
    }

    /**
     * orderBy 中的维度优先，完整维度键兜底，保证顺序确定
     */
    private static Comparator<ComposedRow> outputOrder(List<String> dims, List<String> orderBy) {
        Comparator<ComposedRow> order = Comparator.comparing(ComposedRow::metricDate, Comparator.reverseOrder());
        for (String column : orderBy) {
            int idx = dims.indexOf(column);
            if (idx < 0) {
                throw new IllegalArgumentException("Order column " + column + " is not a dimension of " + dims);
            }
            order = order.thenComparing(row -> row.dimensionKey().get(idx));
        }
        return order.thenComparing(ComposedRow::dimensionKey);
    }

    private static List<String> valueColumns(List<MetricSeries> seriesList, List<SeriesColumns> names) {
        Set<String> columns = new LinkedHashSet<>();
        for (int i = 0; i < seriesList.size(); i++) {
            MetricSeries series = seriesList.get(i);
            addUnique(columns, names.get(i).valueColumn());
            for (String alias : series.comparisonAliases()) {
                addUnique(columns, names.get(i).comparisonColumn(alias));
            }
        }
        return new ArrayList<>(columns);
    }

    private static List<String> flagColumns(List<FlagRule> rules, List<String> valueColumns) {
        Set<String> known = new HashSet<>(valueColumns);
        Set<String> columns = new LinkedHashSet<>();
        for (FlagRule rule : rules) {
            for (String field : rule.condition().fields()) {
                if (!known.contains(field)) {
                    throw new IllegalArgumentException("Flag " + rule.name() + " references unknown column " + field
                            + ", available: " + valueColumns);
                }
            }
            if (known.contains(rule.outputField())) {
                throw new IllegalArgumentException("Flag column " + rule.outputField() + " collides with a value column");
            }
            addUnique(columns, rule.outputField());
        }
        return new ArrayList<>(columns);
    }

    private static void addUnique(Set<String> columns, String column) {
        if (!columns.add(column)) {
            throw new IllegalArgumentException("Duplicate output column: " + column);
        }
    }
}
