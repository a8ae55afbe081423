package com.asiainfo.trendmetrics.domain.exception;

/**
 * 指标引擎异常基类
 * 配置类错误 (定义非法、重复、未知指标、粒度不支持) 均为致命错误，中止整次计算
 */
public class MetricsException extends RuntimeException {

    public MetricsException(String message) {
        super(message);
    }

    public MetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
