package com.asiainfo.trendmetrics.domain.engine;

import com.asiainfo.trendmetrics.domain.model.BucketKey;
import com.asiainfo.trendmetrics.domain.model.ComparedMetricPoint;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.Grain;
import com.asiainfo.trendmetrics.domain.model.MetricPoint;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 周期对比 (同比/环比)
 *
 * 上期定位: 同一维度键下 grain.minus(bucket, interval) 的桶，按粒度回退而不是按行回退，
 * 因此序列中的缺口会让对比值为 null，而不是错位到更早的桶。
 * 上期不存在或比值分母为 0 时对比值为 null，不抛异常。
 */
@ApplicationScoped
public class PeriodComparator {

    public List<ComparedMetricPoint> compare(List<MetricPoint> points, Grain grain, List<ComparisonSpec> specs) {
        Map<BucketKey, MetricPoint> index = new HashMap<>(points.size() * 2);
        for (MetricPoint point : points) {
            if (index.put(point.key(), point) != null) {
                throw new IllegalArgumentException("Duplicate point for " + point.key()
                        + " in metric " + point.metricName());
            }
        }

        List<MetricPoint> ordered = new ArrayList<>(points);
        ordered.sort((a, b) -> a.key().compareTo(b.key()));

        List<ComparedMetricPoint> result = new ArrayList<>(ordered.size());
        for (MetricPoint current : ordered) {
            Map<String, Double> comparisons = new LinkedHashMap<>();
            for (ComparisonSpec spec : specs) {
                BucketKey priorKey = new BucketKey(current.dimensionKey(),
                        grain.minus(current.bucketStart(), spec.interval()));
                MetricPoint prior = index.get(priorKey);
                comparisons.put(spec.alias(), prior == null ? null : calculate(spec, current.value(), prior.value()));
            }
            result.add(ComparedMetricPoint.from(current, comparisons));
        }
        return result;
    }

    /**
     * @return 对比值；分母为 0 或结果非有限数时返回 null
     */
    public static Double calculate(ComparisonSpec spec, double current, double prior) {
        double v = switch (spec.strategy()) {
            case RATIO -> {
                if (prior == 0d) {
                    yield Double.NaN;
                }
                yield current / prior;
            }
            case DELTA -> current - prior;
        };
        return Double.isFinite(v) ? v : null;
    }
}
