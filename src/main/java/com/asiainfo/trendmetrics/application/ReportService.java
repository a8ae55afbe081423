package com.asiainfo.trendmetrics.application;

import com.asiainfo.trendmetrics.domain.composition.ComposedRow;
import com.asiainfo.trendmetrics.domain.composition.MetricComposer;
import com.asiainfo.trendmetrics.domain.composition.MetricTable;
import com.asiainfo.trendmetrics.domain.engine.MetricEvaluator;
import com.asiainfo.trendmetrics.domain.exception.MetricsException;
import com.asiainfo.trendmetrics.domain.model.MetricRequest;
import com.asiainfo.trendmetrics.domain.model.MetricSeries;
import com.asiainfo.trendmetrics.domain.registry.ReportCatalog;
import com.asiainfo.trendmetrics.domain.registry.ReportDefinition;
import com.asiainfo.trendmetrics.infrastructure.config.EngineConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 报表服务
 * 一个报表内的各指标互相独立，并行计算后按 (维度, 时间桶) 关联并打标
 *
 * @see MetricComposer
 */
@ApplicationScoped
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    @Inject
    ReportCatalog catalog;
    @Inject
    MetricEvaluator evaluator;
    @Inject
    MetricComposer composer;
    @Inject
    EngineConfig config;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        int threads = config.getParallelism();
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "metric-eval-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Metric evaluation pool started with {} thread(s)", threads);
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public MetricTable run(String reportName) {
        return run(reportName, null, null);
    }

    public MetricTable run(String reportName, LocalDate startDate, LocalDate endDate) {
        return run(catalog.resolve(reportName), startDate, endDate);
    }

    public MetricTable run(ReportDefinition report, LocalDate startDate, LocalDate endDate) {
        long t0 = System.currentTimeMillis();
        log.info("开始计算报表 {}，粒度 {}，窗口 [{}, {})", report.name(), report.grain(), startDate, endDate);

        List<MetricSeries> series = evaluateAll(report.toRequests(startDate, endDate));
        MetricTable table = composer.compose(series, report.seriesColumns(), report.flags(), report.orderBy());

        log.info("报表 {} 计算完成: {} 行, 标记统计 {}, 耗时 {}ms",
                report.name(), table.size(), flagCounts(table), System.currentTimeMillis() - t0);
        return table;
    }

    /**
     * 并行计算多个指标，结果顺序与请求顺序一致
     * 任一指标失败时原样抛出其异常
     */
    public List<MetricSeries> evaluateAll(List<MetricRequest> requests) {
        if (requests.size() <= 1 || executor == null) {
            List<MetricSeries> result = new ArrayList<>(requests.size());
            for (MetricRequest req : requests) {
                result.add(evaluator.evaluate(req));
            }
            return result;
        }

        List<Callable<MetricSeries>> tasks = new ArrayList<>(requests.size());
        for (MetricRequest req : requests) {
            tasks.add(() -> evaluator.evaluate(req));
        }

        try {
            List<Future<MetricSeries>> futures = executor.invokeAll(tasks);
            List<MetricSeries> result = new ArrayList<>(futures.size());
            for (Future<MetricSeries> f : futures) {
                result.add(f.get());
            }
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new MetricsException("Metric evaluation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricsException("Metric evaluation interrupted", e);
        }
    }

    private static Map<String, Long> flagCounts(MetricTable table) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String flag : table.flagColumns()) {
            long n = 0;
            for (ComposedRow row : table.rows()) {
                if (row.flag(flag)) {
                    n++;
                }
            }
            counts.put(flag, n);
        }
        return counts;
    }
}
