package com.asiainfo.trendmetrics.domain.registry;

import com.asiainfo.trendmetrics.domain.exception.DuplicateMetricException;
import com.asiainfo.trendmetrics.domain.exception.InvalidDefinitionException;
import com.asiainfo.trendmetrics.domain.exception.UnknownMetricException;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 指标注册表
 * 启动时由定义文件一次性填充，随后 seal() 变为只读，计算期间不再修改
 */
@ApplicationScoped
public class MetricRegistry {

    private static final Logger log = LoggerFactory.getLogger(MetricRegistry.class);

    private final Map<String, MetricDefinition> definitions = new ConcurrentHashMap<>();
    private volatile boolean sealed = false;

    public void register(MetricDefinition definition) {
        if (sealed) {
            throw new IllegalStateException("Metric registry is sealed, cannot register "
                    + (definition == null ? null : definition.name()));
        }
        validate(definition);
        MetricDefinition existing = definitions.putIfAbsent(definition.name(), definition);
        if (existing != null) {
            throw new DuplicateMetricException(definition.name());
        }
        log.info("Registered metric: {} ({} of {} from {}, grains={}, dims={})",
                definition.name(), definition.calculationMethod(), definition.expression(),
                definition.source(), definition.allowedGrains(), definition.dimensions());
    }

    public MetricDefinition resolve(String name) {
        MetricDefinition definition = name == null ? null : definitions.get(name);
        if (definition == null) {
            throw new UnknownMetricException(name);
        }
        return definition;
    }

    public boolean contains(String name) {
        return name != null && definitions.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(definitions.keySet());
    }

    /**
     * 冻结注册表，之后的 register 调用将失败
     */
    public void seal() {
        sealed = true;
        log.info("Metric registry sealed with {} metric(s)", definitions.size());
    }

    public boolean isSealed() {
        return sealed;
    }

    private void validate(MetricDefinition def) {
        if (def == null) {
            throw new InvalidDefinitionException("Metric definition must not be null");
        }
        String name = def.name();
        if (isBlank(name)) {
            throw new InvalidDefinitionException("Metric name is required");
        }
        if (def.calculationMethod() == null) {
            throw new InvalidDefinitionException("Metric " + name + " has no calculation method");
        }
        if (isBlank(def.expression())) {
            throw new InvalidDefinitionException("Metric " + name + " has no expression");
        }
        if (isBlank(def.timestampField())) {
            throw new InvalidDefinitionException("Metric " + name + " has no timestamp field");
        }
        if (def.allowedGrains().isEmpty()) {
            throw new InvalidDefinitionException("Metric " + name + " declares no time grains");
        }
        Set<String> seen = new HashSet<>();
        for (String dim : def.dimensions()) {
            if (isBlank(dim)) {
                throw new InvalidDefinitionException("Metric " + name + " has a blank dimension");
            }
            if (!seen.add(dim)) {
                throw new InvalidDefinitionException("Metric " + name + " repeats dimension " + dim);
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
