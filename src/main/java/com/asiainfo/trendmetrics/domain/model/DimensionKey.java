package com.asiainfo.trendmetrics.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * 维度键: 有序的维度取值元组，唯一标识一个被度量的实体 (如某张表)
 */
public record DimensionKey(List<String> values) implements Comparable<DimensionKey> {

    public DimensionKey {
        // List.copyOf 拒绝 null 元素，含空维度值的行在对齐阶段已被剔除
        values = List.copyOf(values);
    }

    public static DimensionKey of(String... values) {
        return new DimensionKey(Arrays.asList(values));
    }

    public String get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    @Override
    public int compareTo(DimensionKey other) {
        int n = Math.min(values.size(), other.values.size());
        for (int i = 0; i < n; i++) {
            int c = values.get(i).compareTo(other.values.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public String toString() {
        return String.join("|", values);
    }
}
