package com.asiainfo.trendmetrics.infrastructure.source;

import com.asiainfo.trendmetrics.domain.exception.InvalidDefinitionException;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.shared.MetricsConstants;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;

/**
 * 生成读取快照行的 SQL (DuckDB 方言)
 *
 * 输出列: snapshot_ts, 各维度列 (VARCHAR), metric_value (DOUBLE)
 * 时间窗口以 yyyy-MM-dd 字符串绑定再转 DATE: [startDate, endDate)
 */
@ApplicationScoped
public class SourceQueryBuilder {

    public static final String TS_COLUMN = "snapshot_ts";
    public static final String VALUE_COLUMN = "metric_value";

    public String build(MetricDefinition def, List<String> dimensions, LocalDate startDate, LocalDate endDate) {
        String source = def.source();
        if (source == null || source.isBlank()) {
            throw new InvalidDefinitionException("Metric " + def.name() + " has no source");
        }
        String ts = requireIdentifier(def.name(), def.timestampField());

        StringBuilder sql = new StringBuilder("SELECT CAST(").append(ts).append(" AS TIMESTAMP) AS ").append(TS_COLUMN);
        for (String dim : dimensions) {
            requireIdentifier(def.name(), dim);
            // DuckDB 标识符不区分大小写，维度列名不能与固定输出列同名
            if (dim.equalsIgnoreCase(TS_COLUMN) || dim.equalsIgnoreCase(VALUE_COLUMN)) {
                throw new InvalidDefinitionException("Metric " + def.name() + ": dimension " + dim
                        + " clashes with reserved output column " + TS_COLUMN + "/" + VALUE_COLUMN);
            }
            sql.append(", CAST(").append(dim).append(" AS VARCHAR) AS ").append(dim);
        }
        // expression 允许派生表达式，如 size_bytes / 1024
        sql.append(", CAST((").append(def.expression()).append(") AS DOUBLE) AS ").append(VALUE_COLUMN);
        sql.append(" FROM ").append(source.trim());

        String tsExpr = "CAST(" + ts + " AS TIMESTAMP)";
        if (startDate != null && endDate != null) {
            sql.append(" WHERE ").append(tsExpr).append(" >= CAST(? AS DATE) AND ")
                    .append(tsExpr).append(" < CAST(? AS DATE)");
        } else if (startDate != null) {
            sql.append(" WHERE ").append(tsExpr).append(" >= CAST(? AS DATE)");
        } else if (endDate != null) {
            sql.append(" WHERE ").append(tsExpr).append(" < CAST(? AS DATE)");
        }
        return sql.toString();
    }

    private static String requireIdentifier(String metric, String column) {
        if (column == null || !MetricsConstants.IDENTIFIER_PATTERN.matcher(column).matches()) {
            throw new InvalidDefinitionException("Metric " + metric + " references invalid column name: " + column);
        }
        return column;
    }
}
