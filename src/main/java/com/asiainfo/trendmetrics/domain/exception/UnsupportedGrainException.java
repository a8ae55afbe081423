package com.asiainfo.trendmetrics.domain.exception;

import com.asiainfo.trendmetrics.domain.model.Grain;

import java.util.Set;

/**
 * 请求粒度不在指标定义的 allowedGrains 内
 */
public class UnsupportedGrainException extends MetricsException {

    private final String metricName;
    private final Grain grain;

    public UnsupportedGrainException(String metricName, Grain grain, Set<Grain> allowed) {
        super(String.format("Grain %s is not allowed for metric %s (allowed: %s)", grain, metricName, allowed));
        this.metricName = metricName;
        this.grain = grain;
    }

    public String getMetricName() {
        return metricName;
    }

    public Grain getGrain() {
        return grain;
    }
}
