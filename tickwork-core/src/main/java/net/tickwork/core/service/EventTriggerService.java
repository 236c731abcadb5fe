package net.tickwork.core.service;

import net.tickwork.core.error.NotFoundException;
import net.tickwork.core.error.ValidationException;
import net.tickwork.core.handler.EventCallback;
import net.tickwork.core.handler.HandlerRegistry;
import net.tickwork.core.handler.JobContext;
import net.tickwork.core.model.Envelope;
import net.tickwork.core.model.EventHandler;
import net.tickwork.core.model.EventHandlerOptions;
import net.tickwork.core.model.HandlerType;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobRequest;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.EventHandlerStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.Subscription;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event-triggered work. Registrations are persisted; the bus subscription and any callback live in
 * this process. One subscription per event name fans out to its handlers by descending priority.
 * Handler failures are counted and logged, never retried.
 */
public final class EventTriggerService {
    private static final Logger log = LoggerFactory.getLogger(EventTriggerService.class);
    private static final long DEFAULT_CREATE_DELAY_MS = 1_000L;

    /** Creates the one-time job for a {@code create_job} action. */
    @FunctionalInterface
    public interface JobCreator {
        Job create(JobRequest request) throws Exception;
    }

    private final EventHandlerStore store;
    private final MessageBus bus;
    private final HandlerRegistry handlers;
    private final TxRunner tx;
    private final Clock clock;
    private final JobCreator jobCreator;

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public EventTriggerService(EventHandlerStore store, MessageBus bus, HandlerRegistry handlers,
                               TxRunner tx, Clock clock, JobCreator jobCreator) {
        this.store = store;
        this.bus = bus;
        this.handlers = handlers;
        this.tx = tx;
        this.clock = clock;
        this.jobCreator = jobCreator;
    }

    public EventHandler register(String eventName, EventCallback callback, EventHandlerOptions options) throws Exception {
        if (callback == null) throw new ValidationException("handler", "event callback is required");
        return register(eventName, EventHandler.Type.FUNCTION, null, callback, options);
    }

    public EventHandler register(String eventName, EventHandler.Action action, EventHandlerOptions options) throws Exception {
        if (action == null || action.type() == null) throw new ValidationException("action", "action type is required");
        validateAction(action);
        return register(eventName, EventHandler.Type.JOB_CREATOR, action, null, options);
    }

    private EventHandler register(String eventName, EventHandler.Type type, EventHandler.Action action,
                                  EventCallback callback, EventHandlerOptions options) throws Exception {
        if (eventName == null || eventName.isBlank()) throw new ValidationException("event_name", "event name is required");
        EventHandlerOptions opts = options == null ? EventHandlerOptions.named(eventName) : options;
        var now = clock.now();
        var handler = new EventHandler(UUID.randomUUID().toString(), eventName,
                opts.handlerName() == null ? eventName : opts.handlerName(), type, opts.enabled(), opts.priority(),
                action, opts.platformId(), 0, 0, 0, null, now, now);
        EventHandler saved = tx.required(() -> store.create(handler));
        attach(saved, callback);
        log.info("Event handler {} ({}) registered for '{}'", saved.id(), saved.handlerName(), eventName);
        return saved;
    }

    /** Re-attaches persisted action handlers after a restart. Callback handlers cannot be restored. */
    public int restore() throws Exception {
        int restored = 0;
        for (EventHandler h : tx.required(store::listAll)) {
            if (registrations.containsKey(h.id())) continue;
            if (h.handlerType() == EventHandler.Type.JOB_CREATOR && h.action() != null) {
                attach(h, null);
                restored++;
            } else {
                log.warn("Event handler {} for '{}' has no in-process callback after restart", h.id(), h.eventName());
            }
        }
        return restored;
    }

    public void trigger(String eventName, Map<String, Object> data) {
        bus.publish(eventName, Envelope.of(eventName, data, clock.now()));
    }

    public List<EventHandler> list(String eventName) throws Exception {
        if (eventName == null) return tx.required(store::listAll);
        return tx.required(() -> store.findByEvent(eventName));
    }

    public EventHandler setEnabled(String handlerId, boolean enabled) throws Exception {
        var now = clock.now();
        if (!tx.required(() -> store.setEnabled(handlerId, enabled, now))) throw NotFoundException.eventHandler(handlerId);
        Registration reg = registrations.get(handlerId);
        if (reg != null) reg.enabled = enabled;
        return tx.required(() -> store.get(handlerId)).orElseThrow(() -> NotFoundException.eventHandler(handlerId));
    }

    public void remove(String handlerId) throws Exception {
        if (!tx.required(() -> store.delete(handlerId))) throw NotFoundException.eventHandler(handlerId);
        Registration reg = registrations.remove(handlerId);
        if (reg != null) {
            synchronized (subscriptions) {
                boolean last = registrations.values().stream().noneMatch(r -> r.handler.eventName().equals(reg.handler.eventName()));
                if (last) {
                    Subscription s = subscriptions.remove(reg.handler.eventName());
                    if (s != null) s.unsubscribe();
                }
            }
        }
        log.info("Event handler {} removed", handlerId);
    }

    private void attach(EventHandler handler, EventCallback callback) {
        registrations.put(handler.id(), new Registration(handler, callback));
        synchronized (subscriptions) {
            subscriptions.computeIfAbsent(handler.eventName(), name -> bus.subscribe(name, this::onEnvelope));
        }
    }

    private void onEnvelope(Envelope envelope) {
        String eventName = envelope.type();
        String platformId = envelope.string("platform_id");
        List<Registration> targets = new ArrayList<>();
        for (Registration r : registrations.values()) {
            if (r.handler.eventName().equals(eventName) && r.enabled && r.handler.appliesTo(platformId)) targets.add(r);
        }
        targets.sort(Comparator.comparingInt((Registration r) -> r.handler.priority()).reversed());

        for (Registration r : targets) {
            boolean ok = true;
            try {
                invoke(r, eventName, envelope.payload());
            } catch (Exception e) {
                ok = false;
                log.warn("Event handler {} ({}) failed on '{}': {}", r.handler.id(), r.handler.handlerName(),
                        eventName, e.getMessage(), e);
            }
            boolean success = ok;
            try {
                tx.required(() -> { store.recordTrigger(r.handler.id(), success, clock.now()); return null; });
            } catch (Exception e) {
                log.warn("Could not record trigger of event handler {}", r.handler.id(), e);
            }
        }
    }

    private void invoke(Registration r, String eventName, Map<String, Object> data) throws Exception {
        if (r.callback != null) {
            r.callback.onEvent(eventName, data);
            return;
        }
        EventHandler.Action action = r.handler.action();
        if (action == null) {
            throw new IllegalStateException("event handler " + r.handler.id() + " has neither callback nor action");
        }
        JobContext ctx = new JobContext(null, r.handler.handlerName(), null, 0, null, null,
                r.handler.platformId(), null);
        switch (action.type()) {
            case CREATE_JOB:
                createJob(r.handler, action, eventName, data);
                break;
            case TRIGGER_WORKFLOW:
                handlers.resolve(action.string("workflow_type"), HandlerType.WORKFLOW).handle(data, ctx);
                break;
            case DISPATCH_AGENT:
                handlers.resolve(action.string("agent_type"), HandlerType.AGENT).handle(data, ctx);
                break;
            default:
                throw new IllegalStateException("unsupported action " + action.type());
        }
    }

    @SuppressWarnings("unchecked")
    private void createJob(EventHandler handler, EventHandler.Action action, String eventName, Map<String, Object> data) throws Exception {
        long delayMs = DEFAULT_CREATE_DELAY_MS;
        Object delay = action.config().get("delay_ms");
        if (delay instanceof Number n) delayMs = Math.max(1L, n.longValue());

        Map<String, Object> payload = new LinkedHashMap<>();
        if (action.config().get("payload") instanceof Map<?, ?> base) payload.putAll((Map<String, Object>) base);
        payload.put("event_name", eventName);
        payload.put("event_data", data);

        String name = action.string("job_name");
        String handlerType = action.string("handler_type");
        Job job = jobCreator.create(JobRequest.builder(name == null ? eventName + ":" + handler.handlerName() : name,
                        action.string("handler_name"))
                .handlerType(handlerType == null ? HandlerType.FUNCTION : HandlerType.from(handlerType))
                .executeAt(clock.now().plusMillis(delayMs))
                .payload(payload)
                .platformId(handler.platformId())
                .createdBy("event:" + handler.id())
                .build());
        log.info("Event '{}' created job {} ({})", eventName, job.id(), job.name());
    }

    private static void validateAction(EventHandler.Action action) {
        switch (action.type()) {
            case CREATE_JOB:
                if (action.string("handler_name") == null) throw new ValidationException("action.handler_name", "create_job requires handler_name");
                if (action.string("handler_type") != null) {
                    try {
                        HandlerType.from(action.string("handler_type"));
                    } catch (IllegalArgumentException e) {
                        throw new ValidationException("action.handler_type", "unknown handler type " + action.string("handler_type"));
                    }
                }
                break;
            case TRIGGER_WORKFLOW:
                if (action.string("workflow_type") == null) throw new ValidationException("action.workflow_type", "trigger_workflow requires workflow_type");
                break;
            case DISPATCH_AGENT:
                if (action.string("agent_type") == null) throw new ValidationException("action.agent_type", "dispatch_agent requires agent_type");
                break;
            default:
                break;
        }
    }

    private static final class Registration {
        final EventHandler handler;
        final EventCallback callback;
        volatile boolean enabled;

        Registration(EventHandler handler, EventCallback callback) {
            this.handler = handler;
            this.callback = callback;
            this.enabled = handler.enabled();
        }
    }
}
