package net.tickwork.core.spi;

import net.tickwork.core.model.EventHandler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventHandlerStore {
    EventHandler create(EventHandler handler) throws Exception;
    Optional<EventHandler> get(String id) throws Exception;
    List<EventHandler> findByEvent(String eventName) throws Exception;
    List<EventHandler> listAll() throws Exception;
    boolean setEnabled(String id, boolean enabled, Instant at) throws Exception;
    void recordTrigger(String id, boolean success, Instant at) throws Exception;
    boolean delete(String id) throws Exception;
}
