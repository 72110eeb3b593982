package com.agentrunner.service;

import com.agentrunner.model.AgentSchedule;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The live timer of one schedule.
 * <p>
 * The trigger fires on a scheduler thread, which only hands the execution to the job executor.
 * At most one execution is in flight: a fire that arrives while the previous one is still running
 * is dropped. The in-flight flag can be shared with the runtime that replaces this one, so a
 * rebuilt schedule waits for the execution started by its predecessor.
 * {@link #stop()} releases the timer without interrupting a running execution.
 */
@Slf4j
public class JobRuntime {

    @Getter
    private final UUID scheduleId;
    @Getter
    private final String recurrenceFingerprint;
    private final ScheduleFiringService firingService;
    private final TaskExecutor jobExecutor;

    private final AtomicBoolean executing;
    private final AtomicLong skippedFires = new AtomicLong();

    @Getter
    private volatile AgentSchedule schedule;
    @Getter
    private volatile boolean stopped;
    @Getter
    private volatile LocalDateTime lastFiredAt;

    // guarded by this
    private ScheduledFuture<?> timerHandle;

    public JobRuntime(AgentSchedule schedule, ScheduleFiringService firingService, TaskExecutor jobExecutor) {
        this(schedule, firingService, jobExecutor, new AtomicBoolean(false));
    }

    public JobRuntime(AgentSchedule schedule, ScheduleFiringService firingService, TaskExecutor jobExecutor,
                      AtomicBoolean executing) {
        this.executing = executing;
        this.scheduleId = schedule.getId();
        this.recurrenceFingerprint = schedule.getCronExpression();
        this.schedule = schedule;
        this.firingService = firingService;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Registers the timer.
     *
     * @return false if the trigger has no upcoming fire time
     */
    public synchronized boolean start(TaskScheduler taskScheduler, Trigger trigger) {
        if (stopped) {
            throw new IllegalStateException("Job runtime for schedule " + scheduleId + " was already stopped");
        }
        if (timerHandle != null) {
            throw new IllegalStateException("Job runtime for schedule " + scheduleId + " is already started");
        }
        timerHandle = taskScheduler.schedule(this::fire, trigger);
        return timerHandle != null;
    }

    public synchronized void stop() {
        stopped = true;
        if (timerHandle != null) {
            timerHandle.cancel(false);
            timerHandle = null;
        }
    }

    void fire() {
        if (stopped) {
            log.debug("Ignoring fire of stopped schedule {}", scheduleId);
            return;
        }
        if (!executing.compareAndSet(false, true)) {
            long skipped = skippedFires.incrementAndGet();
            log.info("Skipping fire of schedule {}: previous execution still running ({} skipped so far)",
                    scheduleId, skipped);
            return;
        }

        AgentSchedule current = schedule;
        lastFiredAt = LocalDateTime.now();
        try {
            jobExecutor.execute(() -> runExecution(current));
        } catch (TaskRejectedException e) {
            executing.set(false);
            log.error("No job thread available for schedule {}, fire dropped: {}", scheduleId, e.getMessage());
        }
    }

    private void runExecution(AgentSchedule current) {
        if (stopped) {
            executing.set(false);
            log.debug("Schedule {} was stopped before its execution started, dropping it", scheduleId);
            return;
        }
        try {
            firingService.fire(current);
        } catch (RuntimeException e) {
            log.error("Unexpected error while executing schedule {}", scheduleId, e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Swaps in a newer copy of the same schedule. Only fields that do not affect the timer
     * (name, payload, notification flag) can differ.
     */
    void refresh(AgentSchedule updated) {
        if (!scheduleId.equals(updated.getId()) || !recurrenceFingerprint.equals(updated.getCronExpression())) {
            throw new IllegalArgumentException("Schedule " + updated.getId() + " does not match runtime " + scheduleId);
        }
        this.schedule = updated;
    }

    public boolean isExecuting() {
        return executing.get();
    }

    public long getSkippedFires() {
        return skippedFires.get();
    }
}
