package net.tickwork.core.service;

import net.tickwork.core.error.TransportException;
import net.tickwork.core.spi.Delivery;
import net.tickwork.core.spi.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pool of consumers in the executor group of the dispatch stream. Workers only coordinate through
 * the bus (one delivery per message per group) and the executor's idempotency markers.
 */
public final class JobConsumerWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobConsumerWorker.class);
    static final Duration TRANSPORT_BACKOFF = Duration.ofSeconds(1);

    private final MessageBus bus;
    private final JobExecutor executor;
    private final String consumerPrefix;
    private final int batchSize;
    private final Duration pollTimeout;

    private final AtomicBoolean running = new AtomicBoolean();
    private final List<Thread> threads = new ArrayList<>();
    private volatile boolean groupReady;

    public JobConsumerWorker(MessageBus bus, JobExecutor executor, int batchSize, Duration pollTimeout) {
        this.bus = bus;
        this.executor = executor;
        this.consumerPrefix = executor.workerId();
        this.batchSize = batchSize;
        this.pollTimeout = pollTimeout;
    }

    public synchronized void start(int workers) {
        if (!running.compareAndSet(false, true)) return;
        ensureGroup();
        for (int i = 0; i < workers; i++) {
            String consumer = consumerPrefix + "-" + i;
            Thread t = new Thread(() -> loop(consumer), "tickwork-consumer-" + i);
            t.setDaemon(true);
            threads.add(t);
            t.start();
        }
        log.info("Started {} consumer(s) on {} / {}", workers, SchedulerEvents.DISPATCH_STREAM, SchedulerEvents.EXECUTOR_GROUP);
    }

    public synchronized void stop(Duration grace) throws InterruptedException {
        if (!running.compareAndSet(true, false)) return;
        for (Thread t : threads) t.interrupt();
        long deadline = System.nanoTime() + grace.toNanos();
        for (Thread t : threads) {
            long left = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            t.join(left);
            if (t.isAlive()) log.warn("Consumer thread {} did not stop within {}", t.getName(), grace);
        }
        threads.clear();
        log.info("Consumers stopped");
    }

    public boolean isRunning() { return running.get(); }

    /** Receives one batch as consumer {@code <worker-id>-0} and processes it on the calling thread. */
    public int pollOnce(Duration wait) throws InterruptedException {
        return pollOnce(consumerPrefix + "-0", wait);
    }

    private int pollOnce(String consumer, Duration wait) throws InterruptedException {
        ensureGroup();
        List<Delivery> batch = bus.receive(SchedulerEvents.DISPATCH_STREAM, SchedulerEvents.EXECUTOR_GROUP,
                consumer, batchSize, wait);
        for (Delivery d : batch) {
            executor.handle(d);
        }
        return batch.size();
    }

    private void loop(String consumer) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce(consumer, pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (TransportException e) {
                log.warn("Consumer {} cannot read from the bus: {}", consumer, e.getMessage());
                pause();
            } catch (RuntimeException e) {
                log.error("Consumer {} loop error", consumer, e);
                pause();
            }
        }
    }

    private void pause() {
        try {
            Thread.sleep(TRANSPORT_BACKOFF.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void ensureGroup() {
        if (groupReady) return;
        bus.createGroup(SchedulerEvents.DISPATCH_STREAM, SchedulerEvents.EXECUTOR_GROUP);
        groupReady = true;
    }

    @Override
    public void close() throws InterruptedException {
        stop(Duration.ofSeconds(5));
    }
}
