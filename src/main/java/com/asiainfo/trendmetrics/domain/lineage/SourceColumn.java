package com.asiainfo.trendmetrics.domain.lineage;

/**
 * 源模型上的一列，如 table_metadata_snapshot.row_count
 */
public record SourceColumn(String model, String column) {

    public SourceColumn {
        if (model == null || model.isBlank() || column == null || column.isBlank()) {
            throw new IllegalArgumentException("Source model and column are required");
        }
    }

    @Override
    public String toString() {
        return model + "." + column;
    }
}
