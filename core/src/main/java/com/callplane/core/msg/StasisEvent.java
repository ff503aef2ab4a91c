package com.callplane.core.msg;

import lombok.Value;

/**
 * Routing information extracted from an inbound Stasis message.
 */
@Value
public class StasisEvent {
    String asteriskId;
    String applicationName;
}
