package net.tickwork.core.handler;

import java.util.Map;

/** Bridge to the platform's agent runtime. */
public interface AgentDispatcher {
    boolean exists(String agentType);

    Object dispatch(String agentType, Map<String, Object> payload, JobContext context) throws Exception;
}
