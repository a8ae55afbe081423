package com.asiainfo.trendmetrics.domain.exception;

/**
 * 读取源快照数据失败，原样向调用方传播，引擎不做重试
 */
public class SourceAccessException extends MetricsException {

    public SourceAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
