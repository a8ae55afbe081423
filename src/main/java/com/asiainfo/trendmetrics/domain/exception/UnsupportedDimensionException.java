package com.asiainfo.trendmetrics.domain.exception;

import java.util.List;

/**
 * 请求维度未在指标定义中声明
 */
public class UnsupportedDimensionException extends MetricsException {

    public UnsupportedDimensionException(String metricName, String dimension, List<String> declared) {
        super(String.format("Dimension %s is not declared for metric %s (declared: %s)",
                dimension, metricName, declared));
    }
}
