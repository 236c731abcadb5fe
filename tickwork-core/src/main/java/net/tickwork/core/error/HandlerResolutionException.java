package net.tickwork.core.error;

import java.util.Map;

/** No handler registered under the requested name and type. A configuration error, never retried. */
public class HandlerResolutionException extends SchedulerException {
    public HandlerResolutionException(String handlerName, String handlerType) {
        super("HANDLER_NOT_FOUND", "no " + handlerType + " handler registered as '" + handlerName + "'",
                Map.of("handler_name", String.valueOf(handlerName), "handler_type", String.valueOf(handlerType)));
    }
}
