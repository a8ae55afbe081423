package com.asiainfo.trendmetrics.infrastructure.source;

import com.asiainfo.trendmetrics.domain.exception.SourceAccessException;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.model.SourceRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 DuckDB 的快照读取
 * source 可以是库内表名，也可以是 read_parquet('...') 之类的表函数
 */
@ApplicationScoped
public class DuckDBSnapshotSource implements SnapshotSource {

    private static final Logger log = LoggerFactory.getLogger(DuckDBSnapshotSource.class);

    @Inject
    SourceQueryBuilder queryBuilder;

    @ConfigProperty(name = "metrics.source.jdbc-url", defaultValue = "jdbc:duckdb:")
    String jdbcUrl;

    @Override
    public List<SourceRow> fetch(MetricDefinition definition, List<String> dimensions,
            LocalDate startDate, LocalDate endDate) {
        String sql = queryBuilder.build(definition, dimensions, startDate, endDate);
        log.debug("[Source] metric={}, sql={}", definition.name(), sql);

        long t0 = System.currentTimeMillis();
        try (Connection conn = DriverManager.getConnection(jdbcUrl);
                PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            if (startDate != null) {
                ps.setString(idx++, startDate.toString());
            }
            if (endDate != null) {
                ps.setString(idx, endDate.toString());
            }

            List<SourceRow> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs, dimensions));
                }
            }
            log.info("Loaded {} snapshot row(s) for metric {} in {}ms",
                    rows.size(), definition.name(), System.currentTimeMillis() - t0);
            return rows;
        } catch (SQLException e) {
            log.error("DuckDB snapshot query failed: {}", sql, e);
            throw new SourceAccessException("Failed to read snapshots for metric " + definition.name(), e);
        }
    }

    private SourceRow mapRow(ResultSet rs, List<String> dimensions) throws SQLException {
        Timestamp ts = rs.getTimestamp(SourceQueryBuilder.TS_COLUMN);
        LocalDateTime timestamp = ts == null ? null : ts.toLocalDateTime();

        List<String> dimValues = new ArrayList<>(dimensions.size());
        for (String dim : dimensions) {
            dimValues.add(rs.getString(dim));
        }

        double v = rs.getDouble(SourceQueryBuilder.VALUE_COLUMN);
        Double value = rs.wasNull() ? null : v;
        return new SourceRow(timestamp, dimValues, value);
    }
}
