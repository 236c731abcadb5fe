package net.tickwork.core.handler;

import net.tickwork.core.error.HandlerResolutionException;
import net.tickwork.core.model.HandlerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@code (handler_name, handler_type)} to a {@link JobHandler}.
 * <ul>
 *   <li>{@code function}: handlers registered by name</li>
 *   <li>{@code agent}: the name is an agent type routed through the {@link AgentDispatcher}</li>
 *   <li>{@code workflow}: the name is a workflow type started through the {@link WorkflowTrigger}</li>
 * </ul>
 */
public final class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, JobHandler> functions = new ConcurrentHashMap<>();
    private volatile AgentDispatcher agents;
    private volatile WorkflowTrigger workflows;

    public HandlerRegistry registerFunction(String name, JobHandler handler) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        if (functions.put(name, handler) != null) {
            log.warn("Function handler '{}' replaced", name);
        } else {
            log.debug("Function handler '{}' registered", name);
        }
        return this;
    }

    public boolean unregisterFunction(String name) {
        return functions.remove(name) != null;
    }

    public HandlerRegistry agentDispatcher(AgentDispatcher dispatcher) {
        this.agents = dispatcher;
        return this;
    }

    public HandlerRegistry workflowTrigger(WorkflowTrigger trigger) {
        this.workflows = trigger;
        return this;
    }

    public boolean isResolvable(String name, HandlerType type) {
        if (name == null || type == null) return false;
        switch (type) {
            case FUNCTION:
                return functions.containsKey(name);
            case AGENT:
                return agents != null && agents.exists(name);
            case WORKFLOW:
                return workflows != null && workflows.exists(name);
            default:
                return false;
        }
    }

    public JobHandler resolve(String name, HandlerType type) {
        if (!isResolvable(name, type)) {
            throw new HandlerResolutionException(name, type == null ? null : type.code());
        }
        switch (type) {
            case AGENT: {
                AgentDispatcher d = agents;
                return (payload, ctx) -> d.dispatch(name, payload, ctx);
            }
            case WORKFLOW: {
                WorkflowTrigger w = workflows;
                return (payload, ctx) -> w.trigger(name, payload, ctx);
            }
            default: {
                JobHandler h = functions.get(name);
                if (h == null) throw new HandlerResolutionException(name, type.code());
                return h;
            }
        }
    }

    public Set<String> functionNames() {
        return new TreeSet<>(functions.keySet());
    }
}
