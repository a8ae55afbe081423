package com.asiainfo.trendmetrics.domain.exception;

/**
 * 指标或报表定义缺少必填项、取值非法
 */
public class InvalidDefinitionException extends MetricsException {

    public InvalidDefinitionException(String message) {
        super(message);
    }

    public InvalidDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
