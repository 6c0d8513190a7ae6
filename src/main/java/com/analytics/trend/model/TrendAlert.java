package com.analytics.trend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 趋势告警。仅作提示用途，有固定有效期；
 * 过期告警不再生效，但本引擎不负责删除。
 */
public final class TrendAlert implements Serializable {
    private final String id;
    private final String trendId;
    private final AlertType type;
    private final TrendImpact severity;
    private final String message;
    private final List<String> recommendations;
    private final Instant triggeredAt;
    private final Instant expiresAt;

    public TrendAlert(String id, String trendId, AlertType type, TrendImpact severity, String message,
                      List<String> recommendations, Instant triggeredAt, Instant expiresAt) {
        this.id = id;
        this.trendId = trendId;
        this.type = type;
        this.severity = severity;
        this.message = message;
        this.recommendations = Collections.unmodifiableList(new ArrayList<>(recommendations));
        this.triggeredAt = triggeredAt;
        this.expiresAt = expiresAt;
    }

    public static TrendAlert create(String trendId, AlertType type, TrendImpact severity, String message,
                                    List<String> recommendations, Instant triggeredAt) {
        return new TrendAlert(UUID.randomUUID().toString(), trendId, type, severity, message,
                recommendations, triggeredAt, triggeredAt.plus(type.getValidity()));
    }

    public String getId() { return id; }
    public String getTrendId() { return trendId; }
    public AlertType getType() { return type; }
    public TrendImpact getSeverity() { return severity; }
    public String getMessage() { return message; }
    public List<String> getRecommendations() { return recommendations; }
    public Instant getTriggeredAt() { return triggeredAt; }
    public Instant getExpiresAt() { return expiresAt; }

    public boolean isActive(Instant now) {
        return expiresAt.isAfter(now);
    }
}
