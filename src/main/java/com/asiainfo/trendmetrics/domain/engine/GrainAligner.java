package com.asiainfo.trendmetrics.domain.engine;

import com.asiainfo.trendmetrics.domain.exception.UnsupportedGrainException;
import com.asiainfo.trendmetrics.domain.model.AlignedGroup;
import com.asiainfo.trendmetrics.domain.model.BucketKey;
import com.asiainfo.trendmetrics.domain.model.DimensionKey;
import com.asiainfo.trendmetrics.domain.model.Grain;
import com.asiainfo.trendmetrics.domain.model.MetricDefinition;
import com.asiainfo.trendmetrics.domain.model.SourceRow;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 时间粒度对齐
 * 将源行的时间戳截断到粒度边界，并按 (维度键, 时间桶) 分组
 */
@ApplicationScoped
public class GrainAligner {

    private static final Logger log = LoggerFactory.getLogger(GrainAligner.class);

    /**
     * @param definition 指标定义，用于校验粒度
     * @param grain      请求粒度
     * @param rows       源行，维度值顺序与请求维度一致
     * @return 按 (维度键, 时间桶) 升序的分组
     */
    public List<AlignedGroup> align(MetricDefinition definition, Grain grain, List<SourceRow> rows) {
        requireSupported(definition, grain);

        Map<BucketKey, List<Double>> groups = new TreeMap<>();
        int skipped = 0;
        for (SourceRow row : rows) {
            // 空维度无法构成维度键；空时间戳/空取值不参与聚合
            if (row.timestamp() == null || row.value() == null || row.hasNullDimension()) {
                skipped++;
                continue;
            }
            BucketKey key = new BucketKey(new DimensionKey(row.dimensionValues()), grain.align(row.timestamp()));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row.value());
        }

        if (skipped > 0) {
            log.debug("Metric {}: skipped {} of {} source rows with null timestamp, value or dimension",
                    definition.name(), skipped, rows.size());
        }

        List<AlignedGroup> result = new ArrayList<>(groups.size());
        groups.forEach((key, values) -> result.add(new AlignedGroup(key.dimensionKey(), key.bucketStart(), values)));
        return result;
    }

    public void requireSupported(MetricDefinition definition, Grain grain) {
        if (grain == null || !definition.supports(grain)) {
            throw new UnsupportedGrainException(definition.name(), grain, definition.allowedGrains());
        }
    }
}
