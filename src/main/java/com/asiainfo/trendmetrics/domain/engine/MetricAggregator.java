package com.asiainfo.trendmetrics.domain.engine;

import com.asiainfo.trendmetrics.domain.model.AlignedGroup;
import com.asiainfo.trendmetrics.domain.model.CalculationMethod;
import com.asiainfo.trendmetrics.domain.model.MetricPoint;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 分组聚合，每个分组产出一个指标点
 */
@ApplicationScoped
public class MetricAggregator {

    public List<MetricPoint> aggregate(String metricName, CalculationMethod method, List<AlignedGroup> groups) {
        List<MetricPoint> points = new ArrayList<>(groups.size());
        for (AlignedGroup group : groups) {
            points.add(new MetricPoint(metricName, group.dimensionKey(), group.bucketStart(),
                    apply(method, group.values())));
        }
        return points;
    }

    /**
     * 对一组取值应用聚合方式
     * 先排序再累加，保证结果与输入顺序无关
     */
    public static double apply(CalculationMethod method, List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty group");
        }
        if (method == CalculationMethod.COUNT) {
            return values.size();
        }

        double[] sorted = new double[values.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = values.get(i);
        }
        Arrays.sort(sorted);

        return switch (method) {
            case SUM -> sum(sorted);
            case AVERAGE -> sum(sorted) / sorted.length;
            case MIN -> sorted[0];
            case MAX -> sorted[sorted.length - 1];
            case COUNT -> sorted.length;
        };
    }

    private static double sum(double[] sorted) {
        double total = 0d;
        for (double v : sorted) {
            total += v;
        }
        return total;
    }
}
