package com.asiainfo.trendmetrics.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * 时间粒度
 * 枚举顺序即时长顺序: DAY < WEEK < MONTH
 *
 * 周粒度固定以周一为起点 (ISO 周)
 */
public enum Grain {
    DAY,
    WEEK,
    MONTH;

    public static final DayOfWeek WEEK_START = DayOfWeek.MONDAY;

    /**
     * 将时间戳向下截断到粒度边界
     */
    public LocalDate align(LocalDateTime timestamp) {
        return align(timestamp.toLocalDate());
    }

    public LocalDate align(LocalDate date) {
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(WEEK_START));
            case MONTH -> date.withDayOfMonth(1);
        };
    }

    /**
     * 回退 steps 个桶, bucketStart 必须已对齐
     */
    public LocalDate minus(LocalDate bucketStart, int steps) {
        return switch (this) {
            case DAY -> bucketStart.minusDays(steps);
            case WEEK -> bucketStart.minusWeeks(steps);
            case MONTH -> bucketStart.minusMonths(steps);
        };
    }

    public LocalDate plus(LocalDate bucketStart, int steps) {
        return minus(bucketStart, -steps);
    }

    /**
     * 向上取整到粒度边界: 已对齐的日期原样返回
     */
    public LocalDate alignUp(LocalDate date) {
        LocalDate floor = align(date);
        return floor.equals(date) ? date : plus(floor, 1);
    }

    /**
     * 解析配置中的粒度名 (day/week/month，不区分大小写)
     *
     * @throws IllegalArgumentException 未知粒度
     */
    public static Grain of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Grain must not be empty");
        }
        try {
            return Grain.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown grain: " + value);
        }
    }
}
