package com.asiainfo.trendmetrics.domain.engine;

import com.asiainfo.trendmetrics.SnapshotFixtures;
import com.asiainfo.trendmetrics.domain.exception.UnknownMetricException;
import com.asiainfo.trendmetrics.domain.exception.UnsupportedDimensionException;
import com.asiainfo.trendmetrics.domain.exception.UnsupportedGrainException;
import com.asiainfo.trendmetrics.domain.model.CalculationMethod;
import com.asiainfo.trendmetrics.domain.model.ComparedMetricPoint;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.DimensionKey;
import com.asiainfo.trendmetrics.domain.model.Grain;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.model.MetricRequest;
import com.asiainfo.trendmetrics.domain.model.MetricSeries;
import com.asiainfo.trendmetrics.domain.model.SourceRow;
import com.asiainfo.trendmetrics.domain.registry.MetricRegistry;
import com.asiainfo.trendmetrics.infrastructure.source.SnapshotSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static com.asiainfo.trendmetrics.SnapshotFixtures.tableRow;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 指标计算流水线测试，源数据用 Mockito 替身
 */
public class MetricEvaluatorTest {

    private static final DimensionKey ORDERS = DimensionKey.of("orders", "public", "warehouse");
    private static final DimensionKey CUSTOMERS = DimensionKey.of("customers", "public", "warehouse");

    private MetricEvaluator evaluator;
    private SnapshotSource source;

    @BeforeEach
    public void setUp() {
        MetricRegistry registry = new MetricRegistry();
        registry.register(SnapshotFixtures.rowCount());
        registry.register(MetricDefinition.of("daily_rows", "table_metadata_snapshot", CalculationMethod.SUM,
                "row_count", "snapshot_timestamp", EnumSet.of(Grain.DAY), SnapshotFixtures.TABLE_DIMS));
        registry.register(MetricDefinition.of("rows_added", "table_metadata_snapshot", CalculationMethod.SUM,
                "row_count", "snapshot_timestamp", EnumSet.allOf(Grain.class), SnapshotFixtures.TABLE_DIMS));
        registry.seal();

        source = mock(SnapshotSource.class);

        evaluator = new MetricEvaluator();
        evaluator.registry = registry;
        evaluator.source = source;
        evaluator.aligner = new GrainAligner();
        evaluator.aggregator = new MetricAggregator();
        evaluator.comparator = new PeriodComparator();
    }

    @Test
    public void testWeeklyRatioEndToEnd() {
        List<SourceRow> rows = List.of(
                tableRow("orders", 1, 100),
                tableRow("orders", 1, 100),
                tableRow("orders", 2, 102),
                tableRow("customers", 1, 50),
                tableRow("customers", 2, 50));
        when(source.fetch(any(), anyList(), any(), any())).thenReturn(rows);

        MetricSeries series = evaluator.evaluate(MetricRequest.of("table_row_count", Grain.WEEK,
                SnapshotFixtures.TABLE_DIMS, List.of(ComparisonSpec.ratio(1, "wow_change"))));

        assertEquals("table_row_count", series.metricName());
        assertEquals(List.of("wow_change"), series.comparisonAliases());
        assertEquals(4, series.points().size());

        ComparedMetricPoint ordersW1 = find(series, ORDERS, SnapshotFixtures.weekStart(1));
        ComparedMetricPoint ordersW2 = find(series, ORDERS, SnapshotFixtures.weekStart(2));
        assertEquals(100d, ordersW1.value());
        assertNull(ordersW1.comparison("wow_change"));
        assertEquals(102d, ordersW2.value());
        assertEquals(1.02, ordersW2.comparison("wow_change"), 1e-12);

        assertEquals(1.0, find(series, CUSTOMERS, SnapshotFixtures.weekStart(2)).comparison("wow_change"), 0d);
    }

    @Test
    public void testEmptyDimensionsDefaultToDefinition() {
        when(source.fetch(any(), anyList(), any(), any())).thenReturn(List.of());

        MetricSeries series = evaluator.evaluate(MetricRequest.of("table_row_count", Grain.DAY, List.of(), List.of()));

        assertTrue(series.isEmpty());
        assertEquals(SnapshotFixtures.TABLE_DIMS, series.dimensions());
        verify(source).fetch(any(), eq(SnapshotFixtures.TABLE_DIMS), isNull(), isNull());
    }

    @Test
    public void testSubsetOfDimensionsRollsUp() {
        // 只按 schema_name 分组时，两张表落在同一个维度键
        when(source.fetch(any(), eq(List.of("schema_name")), any(), any())).thenReturn(List.of(
                SourceRow.of(SnapshotFixtures.weekTs(1), 10d, "public"),
                SourceRow.of(SnapshotFixtures.weekTs(1), 30d, "public")));

        MetricSeries series = evaluator.evaluate(MetricRequest.of("table_row_count", Grain.WEEK,
                List.of("schema_name"), List.of()));

        assertEquals(1, series.points().size());
        assertEquals(DimensionKey.of("public"), series.points().get(0).dimensionKey());
        assertEquals(20d, series.points().get(0).value());
    }

    @Test
    public void testWindowPassedToSource() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 29);
        when(source.fetch(any(), anyList(), any(), any())).thenReturn(List.of());

        // 两端都已在周边界上，且没有对比: 窗口原样下推
        evaluator.evaluate(MetricRequest.of("table_row_count", Grain.WEEK, List.of(), List.of()).withWindow(start, end));

        verify(source).fetch(any(), anyList(), eq(start), eq(end));
    }

    @Test
    public void testWindowStartAlignedWithLookback() {
        stubDailySnapshots(LocalDate.of(2024, 1, 1), 21, 10);
        LocalDate start = LocalDate.of(2024, 1, 10);
        LocalDate end = LocalDate.of(2024, 1, 22);

        MetricSeries series = evaluator.evaluate(MetricRequest.of("rows_added", Grain.WEEK, List.of(),
                List.of(ComparisonSpec.ratio(1, "wow"))).withWindow(start, end));

        // 周三起的窗口按整周 01-08 计算，并多读一周用于环比
        verify(source).fetch(any(), anyList(), eq(LocalDate.of(2024, 1, 1)), eq(end));
        assertEquals(List.of(LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 15)),
                series.points().stream().map(ComparedMetricPoint::bucketStart).toList());

        ComparedMetricPoint first = find(series, ORDERS, LocalDate.of(2024, 1, 8));
        assertEquals(70d, first.value());
        assertEquals(1.0, first.comparison("wow"), 0d);
    }

    @Test
    public void testWindowEndAlignedUp() {
        stubDailySnapshots(LocalDate.of(2024, 1, 1), 21, 10);

        MetricSeries series = evaluator.evaluate(MetricRequest.of("rows_added", Grain.WEEK, List.of(), List.of())
                .withWindow(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 17)));

        verify(source).fetch(any(), anyList(), eq(LocalDate.of(2024, 1, 15)), eq(LocalDate.of(2024, 1, 22)));
        assertEquals(1, series.points().size());
        assertEquals(70d, series.points().get(0).value());
    }

    @Test
    public void testMonthlyLookbackReachesBackByMonths() {
        when(source.fetch(any(), anyList(), any(), any())).thenReturn(List.of());

        evaluator.evaluate(MetricRequest.of("rows_added", Grain.MONTH, List.of(),
                        List.of(ComparisonSpec.ratio(1, "mom"), ComparisonSpec.delta(3, "qoq")))
                .withWindow(LocalDate.of(2024, 5, 20), LocalDate.of(2024, 6, 30)));

        verify(source).fetch(any(), anyList(), eq(LocalDate.of(2024, 2, 1)), eq(LocalDate.of(2024, 7, 1)));
    }

    /**
     * orders 表从 first 起每天中午一条快照，源替身按 [start, end) 过滤
     */
    private void stubDailySnapshots(LocalDate first, int days, double value) {
        List<SourceRow> rows = new ArrayList<>();
        for (int d = 0; d < days; d++) {
            rows.add(SourceRow.of(first.plusDays(d).atTime(12, 0), value, "orders", "public", "warehouse"));
        }
        when(source.fetch(any(), anyList(), any(), any())).thenAnswer(inv -> {
            LocalDate start = inv.getArgument(2);
            LocalDate end = inv.getArgument(3);
            return rows.stream()
                    .filter(r -> start == null || !r.timestamp().toLocalDate().isBefore(start))
                    .filter(r -> end == null || r.timestamp().toLocalDate().isBefore(end))
                    .toList();
        });
    }

    @Test
    public void testUnknownMetric() {
        UnknownMetricException e = assertThrows(UnknownMetricException.class,
                () -> evaluator.evaluate(MetricRequest.of("nope", Grain.WEEK, List.of(), List.of())));
        assertEquals("nope", e.getMetricName());
        verifyNoInteractions(source);
    }

    @Test
    public void testUnsupportedGrainDoesNotReadSource() {
        assertThrows(UnsupportedGrainException.class,
                () -> evaluator.evaluate(MetricRequest.of("daily_rows", Grain.MONTH, List.of(), List.of())));
        verifyNoInteractions(source);
    }

    @Test
    public void testUndeclaredDimensionDoesNotReadSource() {
        assertThrows(UnsupportedDimensionException.class, () -> evaluator.evaluate(
                MetricRequest.of("table_row_count", Grain.WEEK, List.of("owner"), List.of())));
        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate(
                MetricRequest.of("table_row_count", Grain.WEEK, List.of("table_name", "table_name"), List.of())));
        verifyNoInteractions(source);
    }

    @Test
    public void testSourceErrorPropagates() {
        when(source.fetch(any(), anyList(), any(), any())).thenThrow(new IllegalStateException("boom"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> evaluator.evaluate(MetricRequest.of("table_row_count", Grain.WEEK, List.of(), List.of())));
        assertEquals("boom", e.getMessage());
    }

    private static ComparedMetricPoint find(MetricSeries series, DimensionKey key, LocalDate bucket) {
        return series.points().stream()
                .filter(p -> p.dimensionKey().equals(key) && p.bucketStart().equals(bucket))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No point for " + key + " @ " + bucket));
    }
}
