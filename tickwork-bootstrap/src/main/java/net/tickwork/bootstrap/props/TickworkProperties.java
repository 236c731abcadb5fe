package net.tickwork.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("tickwork")
public class TickworkProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Executor executor = new Executor();
    private Bus bus = new Bus();
    private Defaults defaults = new Defaults();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Bus getBus() {
        return bus;
    }

    public void setBus(Bus bus) {
        this.bus = bus;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    /** Dispatch tick and maintenance pass. The delays are read by {@code @Scheduled} placeholders. */
    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 60_000;
        private long maintenanceDelayMs = 60_000;
        private int batchSize = 100;
        private Duration redispatchGrace = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getRedispatchGrace() {
            return redispatchGrace;
        }

        public void setRedispatchGrace(Duration redispatchGrace) {
            this.redispatchGrace = redispatchGrace;
        }
    }

    public static class Executor {
        private boolean enabled = true;
        private String workerId;
        private int workers = 2;
        private Duration pollTimeout = Duration.ofSeconds(5);
        private int batchSize = 10;
        private Duration maxRetryDelay = Duration.ofHours(1);
        private double jitterFactor = 0.1;
        private Duration abandonGrace = Duration.ofMinutes(1);
        private Duration idempotencyTtlFloor = Duration.ofHours(1);
        private Duration shutdownGrace = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getMaxRetryDelay() {
            return maxRetryDelay;
        }

        public void setMaxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public Duration getAbandonGrace() {
            return abandonGrace;
        }

        public void setAbandonGrace(Duration abandonGrace) {
            this.abandonGrace = abandonGrace;
        }

        public Duration getIdempotencyTtlFloor() {
            return idempotencyTtlFloor;
        }

        public void setIdempotencyTtlFloor(Duration idempotencyTtlFloor) {
            this.idempotencyTtlFloor = idempotencyTtlFloor;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }
    }

    public static class Bus {
        private Duration visibilityTimeout = Duration.ofMinutes(5);
        private Duration streamRetention = Duration.ofDays(1);

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public Duration getStreamRetention() {
            return streamRetention;
        }

        public void setStreamRetention(Duration streamRetention) {
            this.streamRetention = streamRetention;
        }
    }

    /** Execution policy for jobs that do not set their own. */
    public static class Defaults {
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(60);
        private Duration timeout = Duration.ofMinutes(5);
        private int concurrency = 1;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    /** A cron job declared in configuration, matched to the stored job by name. */
    public static class JobDef {
        private String name;
        private String description;
        private String cronExpr;
        private String timezone;
        private String handler;
        private String handlerType = "function";
        private Map<String, Object> payload = new LinkedHashMap<>();
        private Integer maxRetries;
        private Duration timeout;
        private String priority;
        private List<String> tags = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getCronExpr() {
            return cronExpr;
        }

        public void setCronExpr(String cronExpr) {
            this.cronExpr = cronExpr;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getHandler() {
            return handler;
        }

        public void setHandler(String handler) {
            this.handler = handler;
        }

        public String getHandlerType() {
            return handlerType;
        }

        public void setHandlerType(String handlerType) {
            this.handlerType = handlerType;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        public void setPayload(Map<String, Object> payload) {
            this.payload = payload;
        }

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getPriority() {
            return priority;
        }

        public void setPriority(String priority) {
            this.priority = priority;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", cronExpr='" + cronExpr + '\'' +
                    ", timezone='" + timezone + '\'' +
                    ", handler='" + handler + '\'' +
                    ", handlerType='" + handlerType + '\'' +
                    '}';
        }
    }
}
