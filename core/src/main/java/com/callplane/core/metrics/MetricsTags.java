package com.callplane.core.metrics;

/**
 * Tag keys used with {@link MetricsNames}.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";
    public static final String REASON = "reason";
    public static final String TYPE = "type";
    public static final String OUTCOME = "outcome";
    public static final String STATUS = "status";
}
