package com.callplane.applicationd.discovery.catalog;

import lombok.Value;

/**
 * State of a key as seen by a blocking read. {@code value} and {@code session} are
 * null when the key does not exist or is not locked.
 */
@Value
public class KvEntry {
    String index;
    String value;
    String session;

    public boolean isLocked() {
        return session != null;
    }
}
