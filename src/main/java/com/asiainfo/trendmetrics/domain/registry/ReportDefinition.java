package com.asiainfo.trendmetrics.domain.registry;

import com.asiainfo.trendmetrics.domain.composition.FlagRule;
import com.asiainfo.trendmetrics.domain.composition.SeriesColumns;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.Grain;
import com.asiainfo.trendmetrics.domain.model.MetricRequest;
import com.asiainfo.trendmetrics.shared.MetricsConstants;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组合报表定义: 同一粒度、同一维度下的多个指标 + 标记规则
 * 如 growth_metrics = table_row_count + table_size_bytes + is_stale/has_rapid_growth
 *
 * orderBy: 同一 metric_date 内的维度排序列，为空时按维度声明顺序
 */
public record ReportDefinition(
        String name,
        Grain grain,
        List<String> dimensions,
        List<ReportMetric> metrics,
        List<FlagRule> flags,
        List<String> orderBy
) {

    public ReportDefinition {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        flags = flags == null ? List.of() : List.copyOf(flags);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    public ReportDefinition(String name, Grain grain, List<String> dimensions, List<ReportMetric> metrics,
            List<FlagRule> flags) {
        this(name, grain, dimensions, metrics, flags, List.of());
    }

    /**
     * 报表中的单个指标及其周期对比
     *
     * @param column            输出列名，为空时用指标名
     * @param comparisonColumns alias -> 输出列名，未列出的用 {@code <metric>_<alias>}
     */
    public record ReportMetric(
            String metric,
            String column,
            List<ComparisonSpec> comparisons,
            Map<String, String> comparisonColumns
    ) {
        public ReportMetric {
            comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
            comparisonColumns = comparisonColumns == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(comparisonColumns));
            if (column != null && column.isBlank()) {
                column = null;
            }
        }

        public ReportMetric(String metric, List<ComparisonSpec> comparisons) {
            this(metric, null, comparisons, Map.of());
        }

        public String valueColumn() {
            return column == null ? metric : column;
        }

        public String comparisonColumn(String alias) {
            String renamed = comparisonColumns.get(alias);
            return renamed == null || renamed.isBlank() ? MetricsConstants.comparisonColumn(metric, alias) : renamed;
        }

        public SeriesColumns columns() {
            Map<String, String> byAlias = new LinkedHashMap<>();
            for (ComparisonSpec spec : comparisons) {
                byAlias.put(spec.alias(), comparisonColumn(spec.alias()));
            }
            return new SeriesColumns(valueColumn(), byAlias);
        }
    }

    public List<MetricRequest> toRequests(LocalDate startDate, LocalDate endDate) {
        return metrics.stream()
                .map(m -> new MetricRequest(m.metric(), grain, dimensions, m.comparisons(), startDate, endDate))
                .toList();
    }

    public List<SeriesColumns> seriesColumns() {
        return metrics.stream().map(ReportMetric::columns).toList();
    }
}
