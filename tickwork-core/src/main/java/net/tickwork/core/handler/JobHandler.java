package net.tickwork.core.handler;

import java.util.Map;

/** Invocable unit behind a job. The returned value is stored as the execution's result. */
@FunctionalInterface
public interface JobHandler {
    Object handle(Map<String, Object> payload, JobContext context) throws Exception;
}
