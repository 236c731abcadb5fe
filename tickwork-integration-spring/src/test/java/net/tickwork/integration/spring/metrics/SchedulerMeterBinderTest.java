package net.tickwork.integration.spring.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.tickwork.core.SchedulerFixture;
import net.tickwork.core.model.JobRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SchedulerMeterBinderTest {

    final SchedulerFixture f = new SchedulerFixture();
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @AfterEach
    void tearDown() {
        f.close();
        registry.close();
    }

    @Test
    void countersAndGauges_followTheEngine() throws Exception {
        new SchedulerMeterBinder(f.tick.stats(), f.executor.stats(), f.jobs, f.tx).bindTo(registry);

        f.handlers.registerFunction("ok", (payload, ctx) -> "done");
        f.handlers.registerFunction("boom", (payload, ctx) -> { throw new IllegalStateException("boom"); });
        f.scheduler.scheduleOnce(JobRequest.builder("fine", "ok").executeAt(f.clock.now().plusSeconds(1)).build());
        f.scheduler.scheduleOnce(JobRequest.builder("broken", "boom").maxRetries(0)
                .executeAt(f.clock.now().plusSeconds(1)).build());
        f.scheduler.schedule(JobRequest.builder("later", "ok").schedule("*/30 * * * *").build());
        f.clock.advance(Duration.ofSeconds(1));

        f.tick.tickOnce();
        f.drain();

        assertEquals(2.0, registry.get("tickwork.dispatch.dispatched").functionCounter().count());
        assertEquals(2.0, registry.get("tickwork.executor.processed").functionCounter().count());
        assertEquals(1.0, registry.get("tickwork.executor.succeeded").functionCounter().count());
        assertEquals(1.0, registry.get("tickwork.executor.failed").functionCounter().count());
        assertEquals(0.0, registry.get("tickwork.executor.duplicates").functionCounter().count());

        assertEquals(1.0, registry.get("tickwork.jobs").tag("status", "active").gauge().value());
        // one-time jobs complete whatever their last execution reported
        assertEquals(2.0, registry.get("tickwork.jobs").tag("status", "completed").gauge().value());
        assertEquals(0.0, registry.get("tickwork.jobs").tag("status", "failed").gauge().value());
    }
}
