package net.tickwork.core.spi;

import net.tickwork.core.model.Envelope;

import java.time.Duration;

/**
 * A stream message handed to one consumer of a group. Until acknowledged it stays invisible to
 * the rest of the group for the bus's visibility window, then becomes deliverable again.
 */
public interface Delivery {
    Envelope envelope();

    /** 1 on first delivery. */
    int deliveryCount();

    void ack();

    void nack(Duration redeliverAfter);

    default void nack() { nack(Duration.ZERO); }
}
