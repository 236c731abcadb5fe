package net.tickwork.core.handler;

import java.util.Map;

/** Bridge to the platform's workflow engine. */
public interface WorkflowTrigger {
    boolean exists(String workflowType);

    Object trigger(String workflowType, Map<String, Object> payload, JobContext context) throws Exception;
}
