package com.callplane.applicationd.discovery;

import com.callplane.core.model.AsteriskNode;
import reactor.core.publisher.Mono;

/**
 * Callback fired when an Asterisk node changes status.
 */
@FunctionalInterface
public interface NodeHandler {
    Mono<Void> handle(AsteriskNode node);
}
