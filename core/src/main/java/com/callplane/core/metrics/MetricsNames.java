package com.callplane.core.metrics;

/**
 * Micrometer metric names used by the dispatcher.
 * <p>
 * <b>Naming convention:</b> {@code callplane.<component>.<metric>}, counters end in {@code .total}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: inbound bus messages taken from the queue and acknowledged.
     */
    public static final String BUS_CONSUMED_TOTAL = "callplane.bus.consumed.total";

    /**
     * Counter: inbound messages dropped before dispatch.
     * <p>
     * Tags: reason (decode_error/missing_type/missing_asterisk_id/invalid_application/unhandled_type/handler_error)
     * </p>
     */
    public static final String BUS_DROPPED_TOTAL = "callplane.bus.dropped.total";

    /**
     * Counter: inbound messages handed to a handler.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String BUS_DISPATCHED_TOTAL = "callplane.bus.dispatched.total";

    /**
     * Counter: outbound events published.
     */
    public static final String BUS_PUBLISHED_TOTAL = "callplane.bus.published.total";

    /**
     * Counter: broker connection attempts.
     * <p>
     * Tags: outcome (success/failure)
     * </p>
     */
    public static final String BUS_CONNECT_TOTAL = "callplane.bus.connect.total";

    /**
     * Counter: node health transitions reported by the watch loop.
     * <p>
     * Tags: status (ok/ko)
     * </p>
     */
    public static final String DISCOVERY_NODE_TRANSITIONS_TOTAL = "callplane.discovery.node.transitions.total";
}
