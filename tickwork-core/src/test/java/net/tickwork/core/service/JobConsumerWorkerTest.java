package net.tickwork.core.service;

import net.tickwork.core.SchedulerFixture;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobConsumerWorkerTest {

    SchedulerFixture f;
    JobConsumerWorker pool;

    @BeforeEach
    void setUp() {
        f = new SchedulerFixture();
        pool = new JobConsumerWorker(f.bus, f.executor, 5, Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() throws Exception {
        pool.close();
        f.close();
    }

    @Test
    void competingWorkers_runEveryExecutionExactlyOnce() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        f.handlers.registerFunction("work", (payload, ctx) -> {
            invocations.incrementAndGet();
            Thread.sleep(20);
            return payload.get("n");
        });
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            jobs.add(f.scheduler.scheduleOnce(JobRequest.builder("job-" + i, "work")
                    .executeAt(f.clock.now().plusSeconds(1)).payload(Map.of("n", i)).build()));
        }
        f.clock.advance(Duration.ofSeconds(1));

        pool.start(4);
        assertTrue(pool.isRunning());
        assertEquals(20, f.tick.tickOnce().dispatched);

        await().atMost(Duration.ofSeconds(10)).until(() -> f.executor.stats().snapshot().succeeded() == 20);

        assertEquals(20, invocations.get());
        for (Job job : jobs) {
            List<JobExecution> executions = f.executions(job.id());
            assertEquals(1, executions.size());
            assertEquals(JobExecution.Status.SUCCESS, executions.get(0).status());
            assertEquals(Job.Status.COMPLETED, f.scheduler.getJob(job.id()).status());
        }

        pool.stop(Duration.ofSeconds(2));
        assertFalse(pool.isRunning());
    }
}
