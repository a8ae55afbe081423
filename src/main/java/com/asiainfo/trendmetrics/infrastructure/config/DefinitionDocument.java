package com.asiainfo.trendmetrics.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 指标定义文档 (YAML)
 * 字段与 metrics.yaml 保持一致，下划线命名
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DefinitionDocument(
        Integer version,
        List<MetricEntry> metrics,
        List<ReportEntry> reports
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetricEntry(
            String name,
            String label,
            String model, // ref('table_metadata_snapshot') 或直接表名
            String description,
            @JsonProperty("calculation_method") String calculationMethod,
            String expression,
            String timestamp,
            @JsonProperty("time_grains") List<String> timeGrains,
            List<String> dimensions
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportEntry(
            String name,
            String grain,
            List<String> dimensions,
            List<ReportMetricEntry> metrics,
            List<FlagEntry> flags,
            @JsonProperty("order_by") List<String> orderBy
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportMetricEntry(
            String metric,
            String column, // 输出列名，缺省为指标名
            List<ComparisonEntry> comparisons
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComparisonEntry(
            String strategy,
            Integer interval,
            String alias,
            String column // 输出列名，缺省为 <metric>_<alias>
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlagEntry(
            String name,
            String output,
            ConditionEntry condition
    ) {}

    /**
     * 条件节点，每个节点只能填一种形式:
     * field + between / greater_than / less_than，或 all_of / any_of
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConditionEntry(
            String field,
            List<Double> between,
            @JsonProperty("greater_than") Double greaterThan,
            @JsonProperty("less_than") Double lessThan,
            @JsonProperty("all_of") List<ConditionEntry> allOf,
            @JsonProperty("any_of") List<ConditionEntry> anyOf
    ) {}
}
