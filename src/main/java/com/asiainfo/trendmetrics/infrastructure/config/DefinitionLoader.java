package com.asiainfo.trendmetrics.infrastructure.config;

import com.asiainfo.trendmetrics.domain.composition.FlagCondition;
import com.asiainfo.trendmetrics.domain.composition.FlagRule;
import com.asiainfo.trendmetrics.domain.exception.InvalidDefinitionException;
import com.asiainfo.trendmetrics.domain.model.CalculationMethod;
import com.asiainfo.trendmetrics.domain.model.ComparisonSpec;
import com.asiainfo.trendmetrics.domain.model.ComparisonStrategy;
import com.asiainfo.trendmetrics.domain.model.Grain;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.registry.ReportDefinition;
import com.asiainfo.trendmetrics.shared.MetricsConstants;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * 定义文档解析
 * 只负责 YAML -> 领域对象的转换与字段校验，不持有状态
 */
@ApplicationScoped
public class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * 读取定义文档：优先按文件路径，不存在时按 classpath 资源
     */
    public DefinitionDocument load(String location) {
        if (location == null || location.isBlank()) {
            throw new InvalidDefinitionException("Definition location is empty");
        }
        Path path = toFilePath(location);
        if (path != null) {
            log.info("Loading metric definitions from file {}", path.toAbsolutePath());
            try (InputStream in = Files.newInputStream(path)) {
                return read(in, location);
            } catch (IOException e) {
                throw new InvalidDefinitionException("Failed to read definition file " + location, e);
            }
        }

        String resource = location.startsWith("/") ? location.substring(1) : location;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new InvalidDefinitionException("Definition document not found: " + location);
            }
            log.info("Loading metric definitions from classpath:{}", resource);
            return read(in, location);
        } catch (IOException e) {
            throw new InvalidDefinitionException("Failed to read definition resource " + location, e);
        }
    }

    private static Path toFilePath(String location) {
        try {
            Path path = Path.of(location);
            return Files.isRegularFile(path) ? path : null;
        } catch (InvalidPathException e) {
            log.debug("{} is not a file path, trying classpath", location);
            return null;
        }
    }

    public DefinitionDocument parse(String yaml) {
        try {
            DefinitionDocument doc = yamlMapper.readValue(yaml, DefinitionDocument.class);
            return doc == null ? new DefinitionDocument(null, null, null) : doc;
        } catch (IOException e) {
            throw new InvalidDefinitionException("Malformed definition document: " + e.getMessage(), e);
        }
    }

    private DefinitionDocument read(InputStream in, String location) throws IOException {
        try {
            DefinitionDocument doc = yamlMapper.readValue(in, DefinitionDocument.class);
            return doc == null ? new DefinitionDocument(null, null, null) : doc;
        } catch (JacksonException e) {
            throw new InvalidDefinitionException("Malformed definition document " + location + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    // --- 指标 ---

    public List<MetricDefinition> toMetricDefinitions(DefinitionDocument doc) {
        List<MetricDefinition> result = new ArrayList<>();
        if (doc.metrics() == null) {
            return result;
        }
        for (DefinitionDocument.MetricEntry entry : doc.metrics()) {
            result.add(toMetricDefinition(entry));
        }
        return result;
    }

    public MetricDefinition toMetricDefinition(DefinitionDocument.MetricEntry entry) {
        String name = entry.name();
        CalculationMethod method = null;
        if (entry.calculationMethod() != null) {
            try {
                method = CalculationMethod.of(entry.calculationMethod());
            } catch (IllegalArgumentException e) {
                throw new InvalidDefinitionException("Metric " + name + ": " + e.getMessage(), e);
            }
        }

        Set<Grain> grains = EnumSet.noneOf(Grain.class);
        if (entry.timeGrains() != null) {
            for (String g : entry.timeGrains()) {
                grains.add(parseGrain("Metric " + name, g));
            }
        }

        return new MetricDefinition(name, entry.label(), entry.description(), resolveSource(entry.model()),
                method, entry.expression(), entry.timestamp(), grains, entry.dimensions());
    }

    /**
     * ref('x') -> x，其它原样返回
     */
    public static String resolveSource(String model) {
        if (model == null) {
            return null;
        }
        Matcher m = MetricsConstants.REF_PATTERN.matcher(model);
        return m.matches() ? m.group(1) : model.trim();
    }

    // --- 报表 ---

    public List<ReportDefinition> toReportDefinitions(DefinitionDocument doc) {
        List<ReportDefinition> result = new ArrayList<>();
        if (doc.reports() == null) {
            return result;
        }
        for (DefinitionDocument.ReportEntry entry : doc.reports()) {
            result.add(toReportDefinition(entry));
        }
        return result;
    }

    public ReportDefinition toReportDefinition(DefinitionDocument.ReportEntry entry) {
        String ctx = "Report " + entry.name();
        Grain grain = entry.grain() == null ? null : parseGrain(ctx, entry.grain());

        List<ReportDefinition.ReportMetric> metrics = new ArrayList<>();
        if (entry.metrics() != null) {
            for (DefinitionDocument.ReportMetricEntry m : entry.metrics()) {
                if (m.metric() == null || m.metric().isBlank()) {
                    throw new InvalidDefinitionException(ctx + " has a metric entry without name");
                }
                List<ComparisonSpec> specs = new ArrayList<>();
                Map<String, String> comparisonColumns = new LinkedHashMap<>();
                if (m.comparisons() != null) {
                    for (DefinitionDocument.ComparisonEntry c : m.comparisons()) {
                        ComparisonSpec spec = toComparison(ctx + "/" + m.metric(), c);
                        specs.add(spec);
                        if (c.column() != null && !c.column().isBlank()) {
                            comparisonColumns.put(spec.alias(), c.column().trim());
                        }
                    }
                }
                String column = m.column() == null ? null : m.column().trim();
                metrics.add(new ReportDefinition.ReportMetric(m.metric(), column, specs, comparisonColumns));
            }
        }

        List<FlagRule> flags = new ArrayList<>();
        if (entry.flags() != null) {
            for (DefinitionDocument.FlagEntry f : entry.flags()) {
                if (f.condition() == null) {
                    throw new InvalidDefinitionException(ctx + ": flag " + f.name() + " has no condition");
                }
                try {
                    flags.add(new FlagRule(f.name(), f.output(), toCondition(f.condition())));
                } catch (IllegalArgumentException e) {
                    throw new InvalidDefinitionException(ctx + ": flag " + f.name() + ": " + e.getMessage(), e);
                }
            }
        }
        return new ReportDefinition(entry.name(), grain, entry.dimensions(), metrics, flags, entry.orderBy());
    }

    private ComparisonSpec toComparison(String ctx, DefinitionDocument.ComparisonEntry c) {
        try {
            ComparisonStrategy strategy = ComparisonStrategy.of(c.strategy());
            int interval = c.interval() == null ? 1 : c.interval();
            return new ComparisonSpec(strategy, interval, c.alias());
        } catch (IllegalArgumentException e) {
            throw new InvalidDefinitionException(ctx + ": " + e.getMessage(), e);
        }
    }

    FlagCondition toCondition(DefinitionDocument.ConditionEntry c) {
        int forms = 0;
        forms += c.between() != null ? 1 : 0;
        forms += c.greaterThan() != null ? 1 : 0;
        forms += c.lessThan() != null ? 1 : 0;
        forms += c.allOf() != null ? 1 : 0;
        forms += c.anyOf() != null ? 1 : 0;
        if (forms != 1) {
            throw new IllegalArgumentException("condition must use exactly one of between/greater_than/less_than/all_of/any_of");
        }

        if (c.allOf() != null) {
            return new FlagCondition.AllOf(c.allOf().stream().map(this::toCondition).toList());
        }
        if (c.anyOf() != null) {
            return new FlagCondition.AnyOf(c.anyOf().stream().map(this::toCondition).toList());
        }
        if (c.between() != null) {
            if (c.between().size() != 2 || c.between().contains(null)) {
                throw new IllegalArgumentException("between needs exactly two bounds for field " + c.field());
            }
            return FlagCondition.between(c.field(), c.between().get(0), c.between().get(1));
        }
        if (c.greaterThan() != null) {
            return FlagCondition.greaterThan(c.field(), c.greaterThan());
        }
        return FlagCondition.lessThan(c.field(), c.lessThan());
    }

    private static Grain parseGrain(String ctx, String value) {
        try {
            return Grain.of(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidDefinitionException(ctx + ": " + e.getMessage(), e);
        }
    }
}
