package net.tickwork.bootstrap.catalog;

import net.tickwork.bootstrap.props.TickworkProperties;
import net.tickwork.core.error.ValidationException;
import net.tickwork.core.model.HandlerType;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobFilter;
import net.tickwork.core.model.JobRequest;
import net.tickwork.core.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Brings the cron jobs declared under {@code tickwork.catalog.jobs} into the store.
 * Jobs are matched by name among the live (non-terminal) ones: missing jobs are created, a changed
 * expression reschedules the existing job, anything else is left as the operator last set it.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    public static final String CREATED_BY = "catalog";

    public enum Result { CREATED, RESCHEDULED, UNCHANGED }

    private final SchedulerService scheduler;
    private final ZoneId zone;

    public CatalogRegistrar(SchedulerService scheduler, ZoneId zone) {
        this.scheduler = scheduler;
        this.zone = zone;
    }

    public List<Result> register(TickworkProperties.Catalog catalog) throws Exception {
        List<Result> results = new ArrayList<>();
        for (var def : catalog.getJobs()) {
            results.add(upsert(def));
        }
        return results;
    }

    private Result upsert(TickworkProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getCronExpr() == null || def.getHandler() == null) {
            throw new ValidationException("catalog", "job name, cron-expr and handler are required: " + def);
        }

        var live = scheduler.listJobs(JobFilter.builder()
                .name(def.getName())
                .statuses(Job.Status.PENDING, Job.Status.ACTIVE, Job.Status.PAUSED)
                .build());
        if (live.isEmpty()) {
            Job job = scheduler.schedule(toRequest(def));
            log.info("Catalog job '{}' created: id={} next_run={}", def.getName(), job.id(), job.nextRun());
            return Result.CREATED;
        }
        if (live.size() > 1) {
            log.warn("Catalog job '{}' matches {} live jobs; using the first", def.getName(), live.size());
        }

        Job existing = live.get(0);
        if (def.getCronExpr().trim().equals(existing.schedule())) {
            log.debug("Catalog job '{}' unchanged", def.getName());
            return Result.UNCHANGED;
        }
        scheduler.reschedule(existing.id(), def.getCronExpr().trim());
        log.info("Catalog job '{}' rescheduled: '{}' -> '{}'", def.getName(), existing.schedule(), def.getCronExpr());
        return Result.RESCHEDULED;
    }

    private JobRequest toRequest(TickworkProperties.JobDef def) {
        return JobRequest.builder(def.getName(), def.getHandler())
                .description(def.getDescription())
                .schedule(def.getCronExpr().trim())
                .timezone(def.getTimezone() != null ? def.getTimezone() : zone.getId())
                .handlerType(HandlerType.from(def.getHandlerType()))
                .payload(new LinkedHashMap<>(def.getPayload()))
                .maxRetries(def.getMaxRetries())
                .timeoutMs(def.getTimeout() == null ? null : def.getTimeout().toMillis())
                .priority(Job.Priority.from(def.getPriority()))
                .tags(List.copyOf(def.getTags()))
                .createdBy(CREATED_BY)
                .build();
    }
}
