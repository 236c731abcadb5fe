package net.tickwork.core.model;

/**
 * @param handlerName label stored with the registration
 * @param priority    handlers for the same event run highest first
 * @param platformId  restricts the handler to events carrying this {@code platform_id}; null for all
 * @param enabled     disabled handlers stay registered but ignore events
 */
public record EventHandlerOptions(String handlerName, int priority, String platformId, boolean enabled) {
    public static EventHandlerOptions named(String handlerName) {
        return new EventHandlerOptions(handlerName, 0, null, true);
    }

    public EventHandlerOptions withPriority(int priority) {
        return new EventHandlerOptions(handlerName, priority, platformId, enabled);
    }

    public EventHandlerOptions forPlatform(String platformId) {
        return new EventHandlerOptions(handlerName, priority, platformId, enabled);
    }

    public EventHandlerOptions disabled() {
        return new EventHandlerOptions(handlerName, priority, platformId, false);
    }
}
