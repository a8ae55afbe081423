package com.asiainfo.trendmetrics.domain.composition;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 标记条件: 关联行上已计算字段的纯函数
 * 引用字段为 null 时所在分支为 false，不抛异常
 */
public interface FlagCondition {

    boolean test(Map<String, Double> fields);

    /**
     * 条件引用的全部字段名
     */
    Set<String> fields();

    static FlagCondition between(String field, double lower, double upper) {
        return new Between(field, lower, upper);
    }

    static FlagCondition greaterThan(String field, double threshold) {
        return new GreaterThan(field, threshold);
    }

    static FlagCondition lessThan(String field, double threshold) {
        return new LessThan(field, threshold);
    }

    static FlagCondition allOf(FlagCondition... conditions) {
        return new AllOf(List.of(conditions));
    }

    static FlagCondition anyOf(FlagCondition... conditions) {
        return new AnyOf(List.of(conditions));
    }

    /**
     * 闭区间 [lower, upper]，与 SQL BETWEEN 一致
     */
    record Between(String field, double lower, double upper) implements FlagCondition {
        public Between {
            requireField(field);
            if (lower > upper) {
                throw new IllegalArgumentException("Between bounds reversed for " + field + ": " + lower + " > " + upper);
            }
        }

        @Override
        public boolean test(Map<String, Double> fields) {
            Double v = fields.get(field);
            return v != null && v >= lower && v <= upper;
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    record GreaterThan(String field, double threshold) implements FlagCondition {
        public GreaterThan {
            requireField(field);
        }

        @Override
        public boolean test(Map<String, Double> fields) {
            Double v = fields.get(field);
            return v != null && v > threshold;
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    record LessThan(String field, double threshold) implements FlagCondition {
        public LessThan {
            requireField(field);
        }

        @Override
        public boolean test(Map<String, Double> fields) {
            Double v = fields.get(field);
            return v != null && v < threshold;
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    record AllOf(List<FlagCondition> conditions) implements FlagCondition {
        public AllOf {
            conditions = requireConditions(conditions);
        }

        @Override
        public boolean test(Map<String, Double> fields) {
            for (FlagCondition c : conditions) {
                if (!c.test(fields)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Set<String> fields() {
            return collectFields(conditions);
        }
    }

    record AnyOf(List<FlagCondition> conditions) implements FlagCondition {
        public AnyOf {
            conditions = requireConditions(conditions);
        }

        @Override
        public boolean test(Map<String, Double> fields) {
            for (FlagCondition c : conditions) {
                if (c.test(fields)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Set<String> fields() {
            return collectFields(conditions);
        }
    }

    private static void requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Flag condition field is required");
        }
    }

    private static List<FlagCondition> requireConditions(List<FlagCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("Composite flag condition needs at least one branch");
        }
        return List.copyOf(conditions);
    }

    private static Set<String> collectFields(List<FlagCondition> conditions) {
        Set<String> all = new LinkedHashSet<>();
        conditions.forEach(c -> all.addAll(c.fields()));
        return all;
    }
}
