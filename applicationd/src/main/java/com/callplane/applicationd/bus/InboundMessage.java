package com.callplane.applicationd.bus;

/**
 * A message delivered by the broker.
 * <p>
 * {@link #ack()} must be called exactly once per delivery, whatever happens to
 * the message afterwards, otherwise the broker redelivers it.
 * </p>
 */
public interface InboundMessage {

    byte[] body();

    void ack();
}
