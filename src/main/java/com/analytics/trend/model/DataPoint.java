package com.analytics.trend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个观测数据点：时间戳 + 数值 + 来源 + 分类。
 * 创建后不可变，分类（category）决定下游分析的分区。
 */
public final class DataPoint implements Serializable {
    private final Instant timestamp;
    private final double value;
    private final String source;
    private final String category;
    private final Map<String, Object> metadata;

    public DataPoint(Instant timestamp, double value, String source, String category,
                     Map<String, Object> metadata) {
        this.timestamp = timestamp;
        this.value = value;
        this.source = source;
        this.category = category;
        this.metadata = (metadata == null || metadata.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Instant getTimestamp() { return timestamp; }
    public double getValue() { return value; }
    public String getSource() { return source; }
    public String getCategory() { return category; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "DataPoint{" + category + "@" + timestamp + "=" + value + ", source='" + source + "'}";
    }
}
