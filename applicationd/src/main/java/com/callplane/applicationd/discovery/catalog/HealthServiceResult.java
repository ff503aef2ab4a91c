package com.callplane.applicationd.discovery.catalog;

import lombok.Value;

import java.util.List;

/**
 * Answer to a health query: the opaque index to pass to the next blocking query
 * and the full set of instances.
 */
@Value
public class HealthServiceResult {
    String index;
    List<CatalogNodeRecord> records;
}
