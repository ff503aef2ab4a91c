package com.callplane.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable view of an Asterisk media server observed in the catalog.
 * <p>
 * A new instance is built from every catalog answer. The watch loop replaces
 * its shadow-table entry wholesale instead of mutating it.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class AsteriskNode {
    /**
     * Stable identity of the node, taken from the {@code eid} service metadata.
     */
    String id;

    String address;

    int port;

    NodeStatus status;

    public boolean isOk() {
        return status == NodeStatus.OK;
    }
}
