package com.asiainfo.trendmetrics.infrastructure.source;

import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.model.SourceRow;

import java.time.LocalDate;
import java.util.List;

/**
 * 源快照数据访问 (只读)
 * 引擎只依赖此接口，快照如何采集与刷新不在本模块范围内
 */
public interface SnapshotSource {

    /**
     * 读取指标源上的全部快照行
     *
     * @param definition 指标定义 (source / timestampField / expression)
     * @param dimensions 需要返回的维度列，SourceRow.dimensionValues 与之同序
     * @param startDate  时间窗口起点 (含)，null 表示不限
     * @param endDate    时间窗口终点 (不含)，null 表示不限
     */
    List<SourceRow> fetch(MetricDefinition definition, List<String> dimensions, LocalDate startDate, LocalDate endDate);
}
