package com.asiainfo.trendmetrics.infrastructure.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 引擎配置
 * 统一管理定义文件位置、并行度与默认报表
 */
@ApplicationScoped
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    // classpath 资源名或文件路径
    @ConfigProperty(name = "metrics.definitions.location", defaultValue = "metrics.yaml")
    String definitionsLocation;

    // 同一报表内指标并行计算的线程数
    @ConfigProperty(name = "metrics.evaluation.parallelism", defaultValue = "4")
    int parallelism;

    // 命令行未指定报表时默认运行的报表
    @ConfigProperty(name = "metrics.report.default-names", defaultValue = "growth_metrics")
    List<String> defaultReportNames;

    @PostConstruct
    void init() {
        log.info("=== Metrics Engine Configuration ===");
        log.info("Definitions:  {}", definitionsLocation);
        log.info("Parallelism:  {}", parallelism);
        log.info("Reports:      {}", defaultReportNames);
        log.info("====================================");
    }

    public String getDefinitionsLocation() {
        return definitionsLocation;
    }

    public int getParallelism() {
        return Math.max(1, parallelism);
    }

    public List<String> getDefaultReportNames() {
        return defaultReportNames;
    }
}
