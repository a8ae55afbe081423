package com.asiainfo.trendmetrics.domain.exception;

public class UnknownMetricException extends MetricsException {

    private final String metricName;

    public UnknownMetricException(String metricName) {
        super("Metric not found: " + metricName);
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
