package com.asiainfo.trendmetrics.domain.lineage;

import com.asiainfo.trendmetrics.domain.composition.FlagRule;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.registry.MetricRegistry;
import com.asiainfo.trendmetrics.domain.registry.ReportCatalog;
import com.asiainfo.trendmetrics.domain.registry.ReportDefinition;
import com.asiainfo.trendmetrics.shared.MetricsConstants;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 列级血缘
 *
 * 上游: 报表每个输出列 -> 源模型列 (维度列、时间戳、表达式中引用的列)。
 * 标记列经由条件字段间接追溯，对比列经由所属值列追溯。
 * 下游: 源模型列 -> 使用它的输出列。
 *
 * 血缘只由定义推导，不读取数据。
 */
@ApplicationScoped
public class LineageResolver {

    /**
     * 表达式中的标识符; 后面紧跟 '(' 的是函数名
     */
    private static final Pattern TOKEN = Pattern.compile("(?<![A-Za-z0-9_])[A-Za-z_][A-Za-z0-9_]*(\\s*\\()?");
    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'");

    private static final Set<String> SQL_KEYWORDS = Set.of(
            "and", "or", "not", "null", "is", "in", "as", "case", "when", "then", "else", "end",
            "between", "like", "distinct", "true", "false", "cast", "double", "integer", "bigint",
            "varchar", "decimal", "date", "timestamp", "interval");

    @Inject
    ReportCatalog reportCatalog;
    @Inject
    MetricRegistry metricRegistry;

    /**
     * 按输出列顺序返回报表全部列的血缘
     */
    public List<ColumnLineage> lineage(String reportName) {
        ReportDefinition report = reportCatalog.resolve(reportName);
        Map<String, ColumnLineage> byColumn = new LinkedHashMap<>();

        for (String dim : report.dimensions()) {
            List<SourceColumn> sources = new ArrayList<>();
            for (ReportDefinition.ReportMetric rm : report.metrics()) {
                sources.add(new SourceColumn(metricRegistry.resolve(rm.metric()).source(), dim));
            }
            put(byColumn, new ColumnLineage(report.name(), dim, ColumnLineage.Kind.DIMENSION, List.of(),
                    distinct(sources), "group by " + dim));
        }

        List<SourceColumn> timestamps = new ArrayList<>();
        for (ReportDefinition.ReportMetric rm : report.metrics()) {
            MetricDefinition def = metricRegistry.resolve(rm.metric());
            timestamps.add(new SourceColumn(def.source(), def.timestampField()));
        }
        put(byColumn, new ColumnLineage(report.name(), MetricsConstants.METRIC_DATE, ColumnLineage.Kind.METRIC_DATE,
                List.of(), distinct(timestamps),
                "date_trunc('" + report.grain().name().toLowerCase(Locale.ROOT) + "', timestamp)"));

        for (ReportDefinition.ReportMetric rm : report.metrics()) {
            MetricDefinition def = metricRegistry.resolve(rm.metric());
            List<SourceColumn> sources = expressionColumns(def);
            String valueColumn = rm.valueColumn();
            put(byColumn, new ColumnLineage(report.name(), valueColumn, ColumnLineage.Kind.VALUE, List.of(), sources,
                    def.calculationMethod().name().toLowerCase(Locale.ROOT) + "(" + def.expression().trim() + ")"));

            for (ComparisonSpec spec : rm.comparisons()) {
                String derivation = spec.strategy().name().toLowerCase(Locale.ROOT) + " of " + valueColumn
                        + " against " + spec.interval() + " " + report.grain().name().toLowerCase(Locale.ROOT)
                        + "(s) earlier";
                put(byColumn, new ColumnLineage(report.name(), rm.comparisonColumn(spec.alias()),
                        ColumnLineage.Kind.COMPARISON, List.of(valueColumn), sources, derivation));
            }
        }

        for (FlagRule rule : report.flags()) {
            // 条件字段按输出列顺序排列
            List<String> inputs = byColumn.keySet().stream().filter(rule.condition().fields()::contains).toList();
            List<SourceColumn> sources = new ArrayList<>();
            for (String input : inputs) {
                sources.addAll(byColumn.get(input).sources());
            }
            put(byColumn, new ColumnLineage(report.name(), rule.outputField(), ColumnLineage.Kind.FLAG, inputs,
                    distinct(sources), "flag " + rule.name() + " over " + inputs));
        }
        return List.copyOf(byColumn.values());
    }

    /**
     * 源模型列 -> 报表中直接或间接使用它的输出列
     */
    public Map<SourceColumn, List<String>> downstream(String reportName) {
        Map<SourceColumn, List<String>> result = new LinkedHashMap<>();
        for (ColumnLineage column : lineage(reportName)) {
            for (SourceColumn source : column.sources()) {
                result.computeIfAbsent(source, k -> new ArrayList<>()).add(column.column());
            }
        }
        result.replaceAll((k, v) -> List.copyOf(v));
        return result;
    }

    /**
     * 表达式中引用的源列: 去掉字符串字面量、函数名和 SQL 关键字后的标识符
     */
    static List<SourceColumn> expressionColumns(MetricDefinition def) {
        String expression = STRING_LITERAL.matcher(def.expression()).replaceAll(" ");
        Set<String> columns = new LinkedHashSet<>();
        Matcher m = TOKEN.matcher(expression);
        while (m.find()) {
            if (m.group(1) != null) {
                continue;
            }
            String token = m.group();
            if (!SQL_KEYWORDS.contains(token.toLowerCase(Locale.ROOT))) {
                columns.add(token);
            }
        }
        return columns.stream().map(c -> new SourceColumn(def.source(), c)).toList();
    }

    private static List<SourceColumn> distinct(List<SourceColumn> columns) {
        return List.copyOf(new LinkedHashSet<>(columns));
    }

    private static void put(Map<String, ColumnLineage> byColumn, ColumnLineage column) {
        if (byColumn.putIfAbsent(column.column(), column) != null) {
            throw new IllegalStateException("Duplicate output column " + column.column()
                    + " in report " + column.report());
        }
    }
}
