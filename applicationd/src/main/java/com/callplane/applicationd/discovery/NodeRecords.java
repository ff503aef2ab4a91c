package com.callplane.applicationd.discovery;

import com.callplane.applicationd.discovery.catalog.CatalogNodeRecord;
import com.callplane.core.model.AsteriskNode;
import com.callplane.core.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps catalog records to {@link AsteriskNode}s.
 * <p>
 * A node is {@link NodeStatus#OK} when every check attached to it is passing. A node
 * without checks is OK. Records missing the {@code eid} metadata, the address or the
 * port cannot be identified and are skipped.
 * </p>
 */
public final class NodeRecords {
    private static final Logger log = LoggerFactory.getLogger(NodeRecords.class);

    static final String EID_META = "eid";
    static final String PASSING = "passing";

    private NodeRecords() {
    }

    public static List<AsteriskNode> toNodes(List<CatalogNodeRecord> records) {
        List<AsteriskNode> nodes = new ArrayList<>(records.size());
        for (CatalogNodeRecord record : records) {
            toNode(record).ifPresent(nodes::add);
        }
        return nodes;
    }

    public static Optional<AsteriskNode> toNode(CatalogNodeRecord record) {
        String eid = record.metaValue(EID_META);
        if (eid == null || eid.isEmpty() || record.getAddress() == null || record.getAddress().isEmpty()
            || record.getPort() == null) {
            log.warn("Ignoring incomplete catalog record {} (eid={}, address={}, port={})",
                record.getServiceId(), eid, record.getAddress(), record.getPort());
            return Optional.empty();
        }

        return Optional.of(AsteriskNode.builder()
            .id(eid)
            .address(record.getAddress())
            .port(record.getPort())
            .status(statusOf(record))
            .build());
    }

    static NodeStatus statusOf(CatalogNodeRecord record) {
        for (String status : record.getCheckStatuses()) {
            if (!PASSING.equals(status)) {
                return NodeStatus.KO;
            }
        }
        return NodeStatus.OK;
    }
}
