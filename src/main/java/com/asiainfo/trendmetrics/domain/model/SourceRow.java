package com.asiainfo.trendmetrics.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 源快照行: 时间戳 + 维度取值 (按请求维度顺序) + 表达式取值
 * 维度值、时间戳和取值都可能为空，由对齐器过滤
 */
public record SourceRow(LocalDateTime timestamp, List<String> dimensionValues, Double value) {

    public SourceRow {
        dimensionValues = dimensionValues == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(dimensionValues));
    }

    public static SourceRow of(LocalDateTime timestamp, Double value, String... dimensionValues) {
        return new SourceRow(timestamp, Arrays.asList(dimensionValues), value);
    }

    public boolean hasNullDimension() {
        return dimensionValues.contains(null);
    }
}
