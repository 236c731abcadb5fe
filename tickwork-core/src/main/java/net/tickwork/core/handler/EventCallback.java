package net.tickwork.core.handler;

import java.util.Map;

/** In-process reaction to a platform event, registered through {@code SchedulerService.onEvent}. */
@FunctionalInterface
public interface EventCallback {
    void onEvent(String eventName, Map<String, Object> data) throws Exception;
}
