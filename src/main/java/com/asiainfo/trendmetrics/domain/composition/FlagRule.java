package com.asiainfo.trendmetrics.domain.composition;

/**
 * 标记规则，输出一个布尔列
 */
public record FlagRule(String name, String outputField, FlagCondition condition) {

    public FlagRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Flag rule name is required");
        }
        if (condition == null) {
            throw new IllegalArgumentException("Flag rule " + name + " has no condition");
        }
        if (outputField == null || outputField.isBlank()) {
            outputField = name;
        }
    }

    public static FlagRule of(String name, FlagCondition condition) {
        return new FlagRule(name, name, condition);
    }
}
