package com.asiainfo.trendmetrics;

import com.asiainfo.trendmetrics.application.ReportService;
import com.asiainfo.trendmetrics.domain.composition.ComposedRow;
import com.asiainfo.trendmetrics.domain.composition.MetricTable;
import com.asiainfo.trendmetrics.domain.exception.MetricsException;
import com.asiainfo.trendmetrics.domain.lineage.ColumnLineage;
import com.asiainfo.trendmetrics.domain.lineage.LineageResolver;
import com.asiainfo.trendmetrics.infrastructure.config.EngineConfig;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * 应用程序主类
 * 由外部调度器按周期拉起，计算一次指定报表后退出
 *
 * 用法: java -jar trend-metrics-runner.jar [reportName ...]
 *       java -jar trend-metrics-runner.jar --lineage [reportName ...]   只输出列级血缘，不读数据
 */
@QuarkusMain
public class Application implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(Application.class);
    private static final String LINEAGE_OPTION = "--lineage";

    @Inject
    ReportService reportService;
    @Inject
    EngineConfig config;
    @Inject
    LineageResolver lineageResolver;

    public static void main(String[] args) {
        Quarkus.run(Application.class, args);
    }

    @Override
    public int run(String... args) {
        boolean lineageOnly = args.length > 0 && LINEAGE_OPTION.equals(args[0]);
        List<String> names = Arrays.asList(args).subList(lineageOnly ? 1 : 0, args.length);
        List<String> reports = names.isEmpty() ? config.getDefaultReportNames() : names;
        try {
            if (lineageOnly) {
                reports.forEach(this::logLineage);
                return 0;
            }
            for (String name : reports) {
                MetricTable table = reportService.run(name);
                logFlaggedRows(name, table);
            }
            return 0;
        } catch (MetricsException e) {
            log.error("Report run aborted: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void logLineage(String report) {
        for (ColumnLineage column : lineageResolver.lineage(report)) {
            log.info("[{}] {} ({}) <- {} : {}", report, column.column(), column.kind(), column.sources(),
                    column.derivation());
        }
    }

    private void logFlaggedRows(String report, MetricTable table) {
        for (ComposedRow row : table.rows()) {
            List<String> raised = table.flagColumns().stream().filter(row::flag).toList();
            if (!raised.isEmpty()) {
                log.info("[{}] {} @ {} -> {}", report, row.dimensionKey(), row.metricDate(), raised);
            }
        }
    }
}
