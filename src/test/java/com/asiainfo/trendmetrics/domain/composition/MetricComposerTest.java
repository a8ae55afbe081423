package com.asiainfo.trendmetrics.domain.composition;

import com.asiainfo.trendmetrics.SnapshotFixtures;
import com.asiainfo.trendmetrics.domain.engine.PeriodComparator;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.DimensionKey;
import com.asiainfo.trendmetrics.domain.model.Grain;
import com.asiainfo.trendmetrics.domain.model.MetricPoint;
import com.asiainfo.trendmetrics.domain.model.MetricSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 多指标关联测试
 */
public class MetricComposerTest {

    private static final List<String> TABLE = List.of("table_name");
    private static final List<ComparisonSpec> GROWTH = List.of(
            ComparisonSpec.ratio(1, "wow_change"), ComparisonSpec.ratio(4, "mom_change"));

    private static final FlagRule IS_STALE = FlagRule.of("is_stale", FlagCondition.allOf(
            FlagCondition.between("table_row_count_wow_change", 0.99, 1.01),
            FlagCondition.between("table_row_count_mom_change", 0.99, 1.01)));
    private static final FlagRule HAS_RAPID_GROWTH = FlagRule.of("has_rapid_growth",
            FlagCondition.greaterThan("table_row_count_wow_change", 1.5));

    private MetricComposer composer;

    @BeforeEach
    public void setUp() {
        composer = new MetricComposer();
        composer.warnOnDroppedRows = true;
    }

    /**
     * 按周构造一个序列，values[i] 为第 i+1 周的值，null 表示该周无数据
     */
    private static MetricSeries weekly(String metric, String table, Double... values) {
        return weekly(metric, Map.of(table, values));
    }

    private static MetricSeries weekly(String metric, Map<String, Double[]> valuesByTable) {
        List<MetricPoint> points = new ArrayList<>();
        valuesByTable.forEach((table, values) -> {
            for (int i = 0; i < values.length; i++) {
                if (values[i] != null) {
                    points.add(new MetricPoint(metric, DimensionKey.of(table), SnapshotFixtures.weekStart(i + 1), values[i]));
                }
            }
        });
        return new MetricSeries(metric, Grain.WEEK, TABLE, List.of("wow_change", "mom_change"),
                new PeriodComparator().compare(points, Grain.WEEK, GROWTH));
    }

    @Test
    public void testColumnsInterleaveComparisons() {
        MetricTable table = composer.compose(List.of(
                        weekly("table_row_count", "orders", 100d),
                        weekly("table_size_bytes", "orders", 4096d)),
                List.of(IS_STALE, HAS_RAPID_GROWTH));

        assertEquals(List.of("table_name", "metric_date",
                "table_row_count", "table_row_count_wow_change", "table_row_count_mom_change",
                "table_size_bytes", "table_size_bytes_wow_change", "table_size_bytes_mom_change",
                "is_stale", "has_rapid_growth"), table.columns());
    }

    @Test
    public void testInnerJoinDropsPartialCombinations() {
        // size_bytes 第 3 周缺数据: 第 3 周整行被丢弃
        MetricTable table = composer.compose(List.of(
                        weekly("table_row_count", "orders", 100d, 102d, 104d),
                        weekly("table_size_bytes", "orders", 10d, 10d, null)),
                List.of());

        assertEquals(2, table.size());
        assertEquals(SnapshotFixtures.weekStart(2), table.rows().get(0).metricDate());
        assertEquals(SnapshotFixtures.weekStart(1), table.rows().get(1).metricDate());
    }

    @Test
    public void testRowsOrderedByDateDescThenDimensionAsc() {
        MetricTable table = composer.compose(List.of(weekly("table_row_count", Map.of(
                "orders", new Double[]{1d, 2d},
                "customers", new Double[]{3d, 4d}))), List.of());

        List<ComposedRow> rows = table.rows();
        assertEquals(4, rows.size());
        assertEquals(SnapshotFixtures.weekStart(2), rows.get(0).metricDate());
        assertEquals(DimensionKey.of("customers"), rows.get(0).dimensionKey());
        assertEquals(DimensionKey.of("orders"), rows.get(1).dimensionKey());
        assertEquals(SnapshotFixtures.weekStart(1), rows.get(2).metricDate());
        assertEquals(DimensionKey.of("customers"), rows.get(2).dimensionKey());
    }

    @Test
    public void testGrowthFlags() {
        MetricTable table = composer.compose(List.of(weekly("table_row_count", Map.of(
                        "orders", new Double[]{100d, 102d},
                        "events", new Double[]{100d, 200d}))),
                List.of(IS_STALE, HAS_RAPID_GROWTH));

        ComposedRow events = row(table, "events", 2);
        assertEquals(2.0, events.value("table_row_count_wow_change"), 1e-12);
        assertTrue(events.flag("has_rapid_growth"));

        ComposedRow orders = row(table, "orders", 2);
        assertEquals(1.02, orders.value("table_row_count_wow_change"), 1e-12);
        assertFalse(orders.flag("has_rapid_growth"));
        // 不足 5 周，月环比为 null，不会被判为停滞
        assertNull(orders.value("table_row_count_mom_change"));
        assertFalse(orders.flag("is_stale"));
    }

    @Test
    public void testStaleAfterSixFlatWeeks() {
        MetricTable table = composer.compose(List.of(
                        weekly("table_row_count", "orders", 500d, 500d, 500d, 500d, 500d, 500d)),
                List.of(IS_STALE, HAS_RAPID_GROWTH));

        for (int week = 1; week <= 6; week++) {
            ComposedRow r = row(table, "orders", week);
            assertEquals(week >= 5, r.flag("is_stale"), "week " + week);
            assertFalse(r.flag("has_rapid_growth"));
        }
    }

    @Test
    public void testDimensionMismatchYieldsEmptyTable() {
        MetricSeries byTable = weekly("table_row_count", "orders", 1d);
        MetricSeries bySchema = new MetricSeries("table_size_bytes", Grain.WEEK, List.of("schema_name"),
                List.of(), List.of());

        MetricTable table = composer.compose(List.of(byTable, bySchema), List.of());
        assertEquals(0, table.size());
        assertEquals(TABLE, table.dimensions());
    }

    @Test
    public void testInvalidColumns() {
        MetricSeries rows = weekly("table_row_count", "orders", 1d);
        assertThrows(IllegalArgumentException.class, () -> composer.compose(List.of(rows),
                List.of(FlagRule.of("f", FlagCondition.greaterThan("table_size_bytes", 1)))));
        assertThrows(IllegalArgumentException.class, () -> composer.compose(List.of(rows),
                List.of(FlagRule.of("table_row_count", FlagCondition.greaterThan("table_row_count", 1)))));
        assertThrows(IllegalArgumentException.class, () -> composer.compose(List.of(rows, rows), List.of()));
        assertThrows(IllegalArgumentException.class, () -> composer.compose(List.of(), List.of()));
    }

    @Test
    public void testRenamedColumnsFeedFlags() {
        SeriesColumns rowCount = new SeriesColumns("avg_row_count", Map.of(
                "wow_change", "row_count_week_over_week_ratio",
                "mom_change", "row_count_month_over_month_ratio"));
        FlagRule rapid = FlagRule.of("has_rapid_growth",
                FlagCondition.greaterThan("row_count_week_over_week_ratio", 1.5));

        MetricTable table = composer.compose(List.of(weekly("table_row_count", "events", 100d, 200d)),
                List.of(rowCount), List.of(rapid), List.of());

        assertEquals(List.of("table_name", "metric_date", "avg_row_count",
                "row_count_week_over_week_ratio", "row_count_month_over_month_ratio", "has_rapid_growth"),
                table.columns());
        ComposedRow latest = table.rows().get(0);
        assertEquals(200d, latest.value("avg_row_count"));
        assertEquals(2.0, latest.value("row_count_week_over_week_ratio"), 1e-12);
        assertTrue(latest.flag("has_rapid_growth"));

        // 默认列名下的规则字段不再存在
        assertThrows(IllegalArgumentException.class, () -> composer.compose(
                List.of(weekly("table_row_count", "events", 1d)), List.of(rowCount), List.of(HAS_RAPID_GROWTH), List.of()));
        assertThrows(IllegalArgumentException.class, () -> composer.compose(
                List.of(weekly("table_row_count", "events", 1d)), List.of(), List.of(), List.of()));
    }

    @Test
    public void testOrderByDimensionsWithinDate() {
        List<String> dims = List.of("table_name", "schema_name");
        List<MetricPoint> points = List.of(
                new MetricPoint("m", DimensionKey.of("accounts", "sales"), SnapshotFixtures.weekStart(1), 1d),
                new MetricPoint("m", DimensionKey.of("orders", "billing"), SnapshotFixtures.weekStart(1), 2d),
                new MetricPoint("m", DimensionKey.of("zones", "billing"), SnapshotFixtures.weekStart(2), 3d));
        MetricSeries series = new MetricSeries("m", Grain.WEEK, dims, List.of(),
                new PeriodComparator().compare(points, Grain.WEEK, List.of()));

        MetricTable table = composer.compose(List.of(series), List.of(SeriesColumns.defaults(series)), List.of(),
                List.of("schema_name", "table_name"));

        // 日期降序优先，同一天内先按 schema_name 再按 table_name
        assertEquals(DimensionKey.of("zones", "billing"), table.rows().get(0).dimensionKey());
        assertEquals(DimensionKey.of("orders", "billing"), table.rows().get(1).dimensionKey());
        assertEquals(DimensionKey.of("accounts", "sales"), table.rows().get(2).dimensionKey());

        assertThrows(IllegalArgumentException.class, () -> composer.compose(List.of(series),
                List.of(SeriesColumns.defaults(series)), List.of(), List.of("database_name")));
    }

    @Test
    public void testToRows() {
        MetricTable table = composer.compose(List.of(weekly("table_row_count", "orders", 100d, 150d)),
                List.of(HAS_RAPID_GROWTH));

        Map<String, Object> latest = table.toRows().get(0);
        assertEquals("orders", latest.get("table_name"));
        assertEquals(SnapshotFixtures.weekStart(2), latest.get("metric_date"));
        assertEquals(150d, latest.get("table_row_count"));
        assertEquals(1.5, latest.get("table_row_count_wow_change"));
        assertEquals(false, latest.get("has_rapid_growth"));
        assertTrue(latest.containsKey("table_row_count_mom_change"));
        assertNull(latest.get("table_row_count_mom_change"));
    }

    private static ComposedRow row(MetricTable table, String tableName, int week) {
        return table.rows().stream()
                .filter(r -> r.dimensionKey().equals(DimensionKey.of(tableName))
                        && r.metricDate().equals(SnapshotFixtures.weekStart(week)))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No row for " + tableName + " week " + week));
    }
}
