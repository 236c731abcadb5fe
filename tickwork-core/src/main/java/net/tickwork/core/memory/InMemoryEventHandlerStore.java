package net.tickwork.core.memory;

import net.tickwork.core.model.EventHandler;
import net.tickwork.core.spi.EventHandlerStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public final class InMemoryEventHandlerStore implements EventHandlerStore {
    private final Map<String, EventHandler> handlers = new LinkedHashMap<>();

    @Override
    public synchronized EventHandler create(EventHandler handler) {
        if (handlers.containsKey(handler.id())) throw new IllegalStateException("duplicate event handler id: " + handler.id());
        handlers.put(handler.id(), handler);
        return handler;
    }

    @Override
    public synchronized Optional<EventHandler> get(String id) {
        return Optional.ofNullable(handlers.get(id));
    }

    @Override
    public synchronized List<EventHandler> findByEvent(String eventName) {
        return handlers.values().stream()
                .filter(h -> h.eventName().equals(eventName))
                .sorted(Comparator.comparingInt(EventHandler::priority).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<EventHandler> listAll() {
        return new ArrayList<>(handlers.values());
    }

    @Override
    public synchronized boolean setEnabled(String id, boolean enabled, Instant at) {
        EventHandler h = handlers.get(id);
        if (h == null) return false;
        handlers.put(id, h.withEnabled(enabled, at));
        return true;
    }

    @Override
    public synchronized void recordTrigger(String id, boolean success, Instant at) {
        EventHandler h = handlers.get(id);
        if (h == null) return;
        handlers.put(id, new EventHandler(h.id(), h.eventName(), h.handlerName(), h.handlerType(), h.enabled(),
                h.priority(), h.action(), h.platformId(), h.triggerCount() + 1,
                h.successCount() + (success ? 1 : 0), h.failureCount() + (success ? 0 : 1),
                at, h.createdAt(), at));
    }

    @Override
    public synchronized boolean delete(String id) {
        return handlers.remove(id) != null;
    }
}
