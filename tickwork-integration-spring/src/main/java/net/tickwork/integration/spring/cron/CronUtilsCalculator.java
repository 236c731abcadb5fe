package net.tickwork.integration.spring.cron;

import net.tickwork.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/** {@link CronCalculator} backed by cron-utils. */
public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.compute(cronExpr, zone, from).nextUtc();
    }

    @Override
    public Optional<Instant> previous(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.previous(cronExpr, zone, from);
    }

    @Override
    public void validate(String cronExpr) {
        CronSlotPlanner.validate(cronExpr);
    }
}
