package net.tickwork.core.error;

import java.util.Map;

/** The message bus could not accept or deliver a message. */
public class TransportException extends SchedulerException {
    public TransportException(String message, String topic, Throwable cause) {
        super("TRANSPORT_ERROR", message, topic == null ? Map.of() : Map.of("topic", topic), cause);
    }
}
