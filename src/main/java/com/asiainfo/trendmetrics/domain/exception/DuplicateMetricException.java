package com.asiainfo.trendmetrics.domain.exception;

public class DuplicateMetricException extends MetricsException {

    private final String metricName;

    public DuplicateMetricException(String metricName) {
        super("Metric already registered: " + metricName);
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
