package com.asiainfo.trendmetrics.shared;

import java.util.regex.Pattern;

public class MetricsConstants {

    // 输出表中的时间桶列
    public static final String METRIC_DATE = "metric_date";

    // 对比列命名: <metric>_<alias>
    public static final String COMPARISON_SEPARATOR = "_";

    // 时间戳与维度列必须是普通标识符，防止拼接进 SQL 时注入
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // 匹配 ref('table_metadata_snapshot') 形式的源引用
    public static final Pattern REF_PATTERN = Pattern.compile("^\\s*ref\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)\\s*$");

    private MetricsConstants() {}

    public static String comparisonColumn(String metricName, String alias) {
        return metricName + COMPARISON_SEPARATOR + alias;
    }
}
