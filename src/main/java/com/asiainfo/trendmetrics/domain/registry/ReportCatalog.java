package com.asiainfo.trendmetrics.domain.registry;

import com.asiainfo.trendmetrics.domain.composition.FlagRule;
import com.asiainfo.trendmetrics.domain.exception.InvalidDefinitionException;
import com.asiainfo.trendmetrics.domain.exception.UnsupportedDimensionException;
import com.asiainfo.trendmetrics.domain.exception.UnsupportedGrainException;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.shared.MetricsConstants;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 报表目录
 * 注册时对照指标注册表做全量校验，配置错误在启动阶段即暴露
 */
@ApplicationScoped
public class ReportCatalog {

    private static final Logger log = LoggerFactory.getLogger(ReportCatalog.class);

    private final Map<String, ReportDefinition> reports = new ConcurrentHashMap<>();
    private volatile boolean sealed = false;

    @Inject
    public MetricRegistry metricRegistry;

    public void register(ReportDefinition report) {
        if (sealed) {
            throw new IllegalStateException("Report catalog is sealed");
        }
        validate(report);
        if (reports.putIfAbsent(report.name(), report) != null) {
            throw new InvalidDefinitionException("Report already defined: " + report.name());
        }
        log.info("Registered report: {} (grain={}, metrics={}, flags={})", report.name(), report.grain(),
                report.metrics().stream().map(ReportDefinition.ReportMetric::metric).toList(),
                report.flags().stream().map(FlagRule::outputField).toList());
    }

    public ReportDefinition resolve(String name) {
        ReportDefinition report = name == null ? null : reports.get(name);
        if (report == null) {
            throw new InvalidDefinitionException("Report not found: " + name);
        }
        return report;
    }

    public Set<String> names() {
        return new TreeSet<>(reports.keySet());
    }

    public void seal() {
        sealed = true;
    }

    private void validate(ReportDefinition report) {
        if (report == null || report.name() == null || report.name().isBlank()) {
            throw new InvalidDefinitionException("Report name is required");
        }
        if (report.grain() == null) {
            throw new InvalidDefinitionException("Report " + report.name() + " has no grain");
        }
        // 各指标共用同一组维度，关联键形状才一致
        if (report.dimensions().isEmpty()) {
            throw new InvalidDefinitionException("Report " + report.name() + " must list its dimensions");
        }
        if (report.metrics().isEmpty()) {
            throw new InvalidDefinitionException("Report " + report.name() + " has no metrics");
        }

        for (String column : report.orderBy()) {
            if (!report.dimensions().contains(column)) {
                throw new InvalidDefinitionException("Report " + report.name() + " orders by " + column
                        + " which is not one of its dimensions " + report.dimensions());
            }
        }

        Set<String> metricNames = new HashSet<>();
        // 值列与对比列，标记规则只能引用这些列
        Set<String> columns = new HashSet<>();
        for (ReportDefinition.ReportMetric rm : report.metrics()) {
            MetricDefinition def = metricRegistry.resolve(rm.metric());
            if (!def.supports(report.grain())) {
                throw new UnsupportedGrainException(def.name(), report.grain(), def.allowedGrains());
            }
            for (String dim : report.dimensions()) {
                if (!def.dimensions().contains(dim)) {
                    throw new UnsupportedDimensionException(def.name(), dim, def.dimensions());
                }
            }
            if (!metricNames.add(def.name())) {
                throw new InvalidDefinitionException("Report " + report.name() + " lists metric "
                        + def.name() + " twice");
            }
            addColumn(report, columns, rm.valueColumn());
            Set<String> aliases = new HashSet<>();
            for (ComparisonSpec spec : rm.comparisons()) {
                aliases.add(spec.alias());
                addColumn(report, columns, rm.comparisonColumn(spec.alias()));
            }
            for (String alias : rm.comparisonColumns().keySet()) {
                if (!aliases.contains(alias)) {
                    throw new InvalidDefinitionException("Report " + report.name() + " renames unknown comparison "
                            + alias + " of metric " + def.name());
                }
            }
        }

        Set<String> outputs = new HashSet<>();
        for (FlagRule rule : report.flags()) {
            for (String field : rule.condition().fields()) {
                if (!columns.contains(field)) {
                    throw new InvalidDefinitionException("Flag " + rule.name() + " of report " + report.name()
                            + " references unknown column " + field);
                }
            }
            if (!outputs.add(rule.outputField()) || columns.contains(rule.outputField())
                    || report.dimensions().contains(rule.outputField())) {
                throw new InvalidDefinitionException("Flag column " + rule.outputField()
                        + " collides with another column in report " + report.name());
            }
        }
    }

    private static void addColumn(ReportDefinition report, Set<String> columns, String column) {
        boolean reserved = report.dimensions().contains(column) || MetricsConstants.METRIC_DATE.equals(column);
        if (reserved || !columns.add(column)) {
            throw new InvalidDefinitionException("Report " + report.name() + " produces column " + column + " twice");
        }
    }
}
