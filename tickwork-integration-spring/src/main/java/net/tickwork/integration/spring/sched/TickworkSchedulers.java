package net.tickwork.integration.spring.sched;

import net.tickwork.core.maintenance.MaintenanceService;
import net.tickwork.core.service.DispatchTickService;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/** Periodic drivers: the dispatch tick and the maintenance pass. */
public class TickworkSchedulers {
    private static final Logger log = LoggerFactory.getLogger(TickworkSchedulers.class);

    private final DispatchTickService tick;
    private final MaintenanceService maintenance;
    private final MessageBus bus;
    private final Clock clock;

    private Duration abandonGrace = Duration.ofMinutes(1);
    private int maintenanceBatchSize = 100;
    private Duration streamRetention = Duration.ofDays(1);

    public TickworkSchedulers(DispatchTickService tick, MaintenanceService maintenance, MessageBus bus, Clock clock) {
        this.tick = tick;
        this.maintenance = maintenance;
        this.bus = bus;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${tickwork.scheduler.tick-delay-ms:60000}")
    public void tick() throws Exception {
        var report = tick.tickOnce();
        if (report.errors > 0 || report.transportFailure) {
            log.warn("Dispatch tick finished with problems: {}", report);
        }
    }

    @Scheduled(fixedDelayString = "${tickwork.scheduler.maintenance-delay-ms:60000}",
               initialDelayString = "${tickwork.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() throws Exception {
        var report = maintenance.runOnce(abandonGrace, maintenanceBatchSize);
        int purged = bus.purgeConsumed(clock.now().minus(streamRetention));
        if (purged > 0) log.info("Purged {} consumed stream message(s)", purged);
        log.debug("Maintenance done: {}", report);
    }

    public void setAbandonGrace(Duration abandonGrace) {
        this.abandonGrace = abandonGrace;
    }

    public void setMaintenanceBatchSize(int maintenanceBatchSize) {
        this.maintenanceBatchSize = maintenanceBatchSize;
    }

    public void setStreamRetention(Duration streamRetention) {
        this.streamRetention = streamRetention;
    }
}
