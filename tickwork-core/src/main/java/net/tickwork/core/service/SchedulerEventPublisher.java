package net.tickwork.core.service;

import net.tickwork.core.error.TransportException;
import net.tickwork.core.model.Envelope;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/** Emits lifecycle events. A failed emit is logged and never fails the operation that caused it. */
public final class SchedulerEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(SchedulerEventPublisher.class);

    private final MessageBus bus;
    private final Clock clock;

    public SchedulerEventPublisher(MessageBus bus, Clock clock) {
        this.bus = bus;
        this.clock = clock;
    }

    public void emit(String event, Map<String, Object> data) {
        try {
            bus.publish(event, Envelope.of(event, data, clock.now()));
        } catch (TransportException e) {
            log.warn("Could not emit {}: {}", event, e.getMessage());
        }
    }

    public void jobEvent(String event, String jobId, String jobName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", jobId);
        data.put("job_name", jobName);
        emit(event, data);
    }

    public void executionEvent(String event, String jobId, String executionId, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", jobId);
        data.put("execution_id", executionId);
        if (extra != null) data.putAll(extra);
        emit(event, data);
    }
}
