package com.asiainfo.trendmetrics.infrastructure.config;

import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.registry.MetricRegistry;
import com.asiainfo.trendmetrics.domain.registry.ReportCatalog;
import com.asiainfo.trendmetrics.domain.registry.ReportDefinition;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 启动时加载定义文档，填充并冻结注册表
 * 任何定义错误都会让启动失败，不会带着部分配置运行
 */
@ApplicationScoped
public class DefinitionBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DefinitionBootstrap.class);

    @Inject
    EngineConfig config;
    @Inject
    DefinitionLoader loader;
    @Inject
    MetricRegistry metricRegistry;
    @Inject
    ReportCatalog reportCatalog;

    void onStart(@Observes StartupEvent event) {
        load(config.getDefinitionsLocation());
    }

    public void load(String location) {
        DefinitionDocument doc = loader.load(location);

        int metrics = 0;
        for (MetricDefinition def : loader.toMetricDefinitions(doc)) {
            metricRegistry.register(def);
            metrics++;
        }
        metricRegistry.seal();

        // 报表校验依赖已注册的指标，必须在指标之后
        int reports = 0;
        for (ReportDefinition report : loader.toReportDefinitions(doc)) {
            reportCatalog.register(report);
            reports++;
        }
        reportCatalog.seal();

        log.info("Loaded {} metric(s) and {} report(s) from {}", metrics, reports, location);
    }
}
