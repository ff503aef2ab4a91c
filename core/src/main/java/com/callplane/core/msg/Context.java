package com.callplane.core.msg;

import lombok.Value;

/**
 * Identity of the Asterisk peer that produced an event.
 * <p>
 * Handed to every handler so that replies can be routed back to the same peer.
 * </p>
 */
@Value
public class Context {
    String asteriskId;
}
