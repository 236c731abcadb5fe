package net.tickwork.core.spi;

import net.tickwork.core.model.Envelope;

@FunctionalInterface
public interface MessageListener {
    void onMessage(Envelope envelope) throws Exception;
}
