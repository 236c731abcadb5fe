package net.tickwork.integration.spring;

import net.tickwork.core.service.JobConsumerWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/** Starts the consumer pool with the context and drains it on shutdown. */
public class ConsumerWorkerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ConsumerWorkerLifecycle.class);

    private final JobConsumerWorker worker;
    private final int workers;
    private final Duration shutdownGrace;

    public ConsumerWorkerLifecycle(JobConsumerWorker worker, int workers, Duration shutdownGrace) {
        this.worker = worker;
        this.workers = workers;
        this.shutdownGrace = shutdownGrace;
    }

    @Override
    public void start() {
        worker.start(workers);
    }

    @Override
    public void stop() {
        try {
            worker.stop(shutdownGrace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping consumers");
        }
    }

    @Override
    public boolean isRunning() {
        return worker.isRunning();
    }

    // stop before the beans the handlers use are destroyed
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1024;
    }
}
