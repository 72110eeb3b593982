package com.agentrunner.service;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * {@link Trigger} over a {@link CronSchedule}, following the same base-time rules as Spring's CronTrigger.
 */
public class CronScheduleTrigger implements Trigger {

    private final CronSchedule schedule;
    private final ZoneId zoneId;

    public CronScheduleTrigger(CronSchedule schedule) {
        this(schedule, ZoneId.systemDefault());
    }

    public CronScheduleTrigger(CronSchedule schedule, ZoneId zoneId) {
        this.schedule = schedule;
        this.zoneId = zoneId;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant instant = triggerContext.lastCompletion();
        if (instant != null) {
            Instant scheduled = triggerContext.lastScheduledExecution();
            if (scheduled != null && instant.isBefore(scheduled)) {
                instant = scheduled;
            }
        } else {
            instant = triggerContext.getClock().instant();
        }
        ZonedDateTime next = schedule.next(ZonedDateTime.ofInstant(instant, zoneId));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public String toString() {
        return schedule.getExpression();
    }
}
