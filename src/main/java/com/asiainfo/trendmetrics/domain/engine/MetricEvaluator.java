package com.asiainfo.trendmetrics.domain.engine;

import com.asiainfo.trendmetrics.domain.exception.UnsupportedDimensionException;
import com.asiainfo.trendmetrics.domain.model.AlignedGroup;
import com.asiainfo.trendmetrics.domain.model.ComparedMetricPoint;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.Grain;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.model.MetricPoint;
import com.asiainfo.trendmetrics.domain.model.MetricRequest;
import com.asiainfo.trendmetrics.domain.model.MetricSeries;
import com.asiainfo.trendmetrics.domain.model.SourceRow;
import com.asiainfo.trendmetrics.domain.registry.MetricRegistry;
import com.asiainfo.trendmetrics.infrastructure.source.SnapshotSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 指标计算入口: 对齐 -> 聚合 -> 周期对比
 * 每个关注的指标调用一次；各阶段异常原样抛出
 *
 * 时间窗口 [start, end) 按整桶处理: start 向下、end 向上对齐到粒度边界，
 * 不会出现被窗口截断的半个桶。
 */
@ApplicationScoped
public class MetricEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MetricEvaluator.class);

    @Inject
    MetricRegistry registry;
    @Inject
    SnapshotSource source;
    @Inject
    GrainAligner aligner;
    @Inject
    MetricAggregator aggregator;
    @Inject
    PeriodComparator comparator;

    public MetricSeries evaluate(MetricRequest request) {
        long t0 = System.currentTimeMillis();

        // 1. 解析定义并校验粒度/维度，配置错误不触发数据读取
        MetricDefinition def = registry.resolve(request.metricName());
        aligner.requireSupported(def, request.grain());
        List<String> dims = resolveDimensions(def, request.dimensions());

        // 2. 读取源数据: 窗口扩到整桶，起点再向前多读最大回看步数，保证首批桶有上期
        Grain grain = request.grain();
        LocalDate reportStart = request.startDate() == null ? null : grain.align(request.startDate());
        LocalDate fetchStart = reportStart == null ? null : grain.minus(reportStart, maxInterval(request));
        LocalDate fetchEnd = request.endDate() == null ? null : grain.alignUp(request.endDate());
        if (request.startDate() != null || request.endDate() != null) {
            log.debug("[Evaluate] metric={}, window [{}, {}) widened to [{}, {})", def.name(),
                    request.startDate(), request.endDate(), fetchStart, fetchEnd);
        }
        List<SourceRow> rows = source.fetch(def, dims, fetchStart, fetchEnd);

        // 3. 对齐 + 聚合
        List<AlignedGroup> groups = aligner.align(def, grain, rows);
        List<MetricPoint> points = aggregator.aggregate(def.name(), def.calculationMethod(), groups);

        // 4. 周期对比，之后去掉只用于回看的桶
        List<ComparedMetricPoint> compared = comparator.compare(points, grain, request.comparisons());
        if (reportStart != null) {
            compared = compared.stream().filter(p -> !p.bucketStart().isBefore(reportStart)).toList();
        }

        log.debug("[Evaluate] metric={}, grain={}, dims={}, rows={}, points={}, cost={}ms",
                def.name(), grain, dims, rows.size(), compared.size(), System.currentTimeMillis() - t0);

        List<String> aliases = request.comparisons().stream().map(ComparisonSpec::alias).toList();
        return new MetricSeries(def.name(), grain, dims, aliases, compared);
    }

    private static int maxInterval(MetricRequest request) {
        int max = 0;
        for (ComparisonSpec spec : request.comparisons()) {
            max = Math.max(max, spec.interval());
        }
        return max;
    }

    private List<String> resolveDimensions(MetricDefinition def, List<String> requested) {
        if (requested.isEmpty()) {
            return def.dimensions();
        }
        Set<String> seen = new HashSet<>();
        for (String dim : requested) {
            if (!def.dimensions().contains(dim)) {
                throw new UnsupportedDimensionException(def.name(), dim, def.dimensions());
            }
            if (!seen.add(dim)) {
                throw new IllegalArgumentException("Dimension " + dim + " requested twice for metric " + def.name());
            }
        }
        return requested;
    }
}
