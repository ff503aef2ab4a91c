package com.callplane.applicationd.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps an event type to its handler.
 * <p>
 * Handlers are registered at startup, before the bus starts consuming. Later
 * registrations are not supported. Registering the same type twice replaces
 * the previous handler.
 * </p>
 */
public class DispatchRegistry {
    private static final Logger log = LoggerFactory.getLogger(DispatchRegistry.class);

    private final Map<String, StasisEventHandler> handlers = new ConcurrentHashMap<>();

    public void register(String type, StasisEventHandler handler) {
        StasisEventHandler previous = handlers.put(type, handler);
        if (previous != null) {
            log.warn("Handler for event type {} replaced", type);
        } else {
            log.debug("Handler registered for event type {}", type);
        }
    }

    public Optional<StasisEventHandler> lookup(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public int size() {
        return handlers.size();
    }
}
