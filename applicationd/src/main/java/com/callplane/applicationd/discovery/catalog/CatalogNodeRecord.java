package com.callplane.applicationd.discovery.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One service instance returned by a health query, with the status of every check
 * attached to it.
 */
@Value
@Builder(toBuilder = true)
public class CatalogNodeRecord {
    String serviceId;
    String address;
    Integer port;
    Map<String, String> meta;
    @Singular
    List<String> checkStatuses;

    public String metaValue(String key) {
        return meta == null ? null : meta.get(key);
    }
}
