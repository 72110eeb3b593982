package com.agentrunner.service;

import com.agentrunner.config.SchedulerConfig;
import com.agentrunner.config.SchedulerProperties;
import com.agentrunner.dto.ReconcileResult;
import com.agentrunner.model.AgentSchedule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps one {@link JobRuntime} per enabled schedule.
 * <p>
 * {@link #tick()} diffs the live runtimes against the enabled rows of the schedule table: runtimes
 * of disabled or deleted schedules are stopped, schedules whose cron expression changed are torn
 * down and rebuilt, new schedules get a runtime. It runs once on {@link #start()} and then at a
 * fixed delay. Ticks are serialized; the runtime map is only mutated from inside a tick or
 * {@link #stop()} and may be read from any thread.
 */
@Service
@Slf4j
public class ScheduleRunner {

    private final ScheduleStore scheduleStore;
    private final ScheduleFiringService firingService;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor jobExecutor;
    private final SchedulerProperties properties;

    private final ConcurrentHashMap<UUID, JobRuntime> runtimes = new ConcurrentHashMap<>();

    // in-flight flag per schedule id, outlives the runtimes built for that schedule
    private final ConcurrentHashMap<UUID, AtomicBoolean> inFlight = new ConcurrentHashMap<>();

    // schedule id -> expression already reported as invalid, guarded by this
    private final Map<UUID, String> reportedInvalid = new HashMap<>();

    private ScheduledFuture<?> reconcileHandle;
    private volatile boolean running;

    public ScheduleRunner(ScheduleStore scheduleStore,
                          ScheduleFiringService firingService,
                          @Qualifier(SchedulerConfig.TIMER_SCHEDULER) TaskScheduler taskScheduler,
                          @Qualifier(SchedulerConfig.JOB_EXECUTOR) TaskExecutor jobExecutor,
                          SchedulerProperties properties) {
        this.scheduleStore = scheduleStore;
        this.firingService = firingService;
        this.taskScheduler = taskScheduler;
        this.jobExecutor = jobExecutor;
        this.properties = properties;
    }

    @PostConstruct
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("Schedule runner is disabled (scheduler.enabled=false)");
            return;
        }
        if (running) {
            return;
        }
        log.info("Starting schedule runner...");
        running = true;

        tick();

        Duration interval = properties.getReconcileInterval();
        reconcileHandle = taskScheduler.scheduleWithFixedDelay(this::tick, Instant.now().plus(interval), interval);
        log.info("Schedule runner started with {} live jobs, reconciling every {}", runtimes.size(), interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping schedule runner...");
        running = false;

        if (reconcileHandle != null) {
            reconcileHandle.cancel(false);
            reconcileHandle = null;
        }
        for (JobRuntime runtime : runtimes.values()) {
            runtime.stop();
        }
        runtimes.clear();
        reportedInvalid.clear();

        log.info("Schedule runner stopped");
    }

    /**
     * One reconciliation pass. Never throws: a failed read of the schedule table leaves the
     * live runtimes untouched until the next pass.
     */
    public synchronized ReconcileResult tick() {
        List<AgentSchedule> enabled;
        try {
            enabled = scheduleStore.listEnabledSchedules();
        } catch (Exception e) {
            log.error("Error loading schedules, keeping {} live jobs until the next pass: {}",
                    runtimes.size(), e.getMessage());
            return ReconcileResult.storeUnavailable(runtimes.size());
        }

        Map<UUID, AgentSchedule> enabledById = new LinkedHashMap<>();
        for (AgentSchedule schedule : enabled) {
            enabledById.put(schedule.getId(), schedule);
        }

        int removed = 0;
        int added = 0;
        int reloaded = 0;
        int invalid = 0;

        // Remove jobs that no longer exist or are disabled
        Iterator<Map.Entry<UUID, JobRuntime>> it = runtimes.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<UUID, JobRuntime> entry = it.next();
            if (!enabledById.containsKey(entry.getKey())) {
                entry.getValue().stop();
                it.remove();
                removed++;
                log.info("Removed job {}", entry.getKey());
            }
        }
        reportedInvalid.keySet().retainAll(enabledById.keySet());
        inFlight.entrySet().removeIf(entry -> !enabledById.containsKey(entry.getKey()) && !entry.getValue().get());

        // Add new jobs and rebuild the ones whose cron expression changed
        for (AgentSchedule schedule : enabledById.values()) {
            UUID scheduleId = schedule.getId();
            String expression = schedule.getCronExpression();
            JobRuntime existing = runtimes.get(scheduleId);

            if (existing != null && Objects.equals(existing.getRecurrenceFingerprint(), expression)) {
                existing.refresh(schedule);
                continue;
            }
            if (existing != null) {
                existing.stop();
                runtimes.remove(scheduleId);
                log.info("Cron expression of schedule {} changed from '{}' to '{}', rebuilding job",
                        scheduleId, existing.getRecurrenceFingerprint(), expression);
            }

            CronSchedule cron;
            try {
                cron = CronSchedule.parse(expression);
            } catch (IllegalArgumentException e) {
                invalid++;
                if (!Objects.equals(reportedInvalid.put(scheduleId, expression), expression)) {
                    log.error("Invalid cron expression for schedule {}: '{}' ({})", scheduleId, expression, e.getMessage());
                }
                continue;
            }
            reportedInvalid.remove(scheduleId);

            if (createJob(schedule, cron)) {
                if (existing != null) {
                    reloaded++;
                } else {
                    added++;
                }
            }
        }

        ReconcileResult result = new ReconcileResult(added, removed, reloaded, invalid, runtimes.size(), true);
        if (result.hasChanges()) {
            log.info("Reconciled schedules: {} added, {} removed, {} reloaded, {} live", added, removed, reloaded, runtimes.size());
        }
        return result;
    }

    private boolean createJob(AgentSchedule schedule, CronSchedule cron) {
        AtomicBoolean executing = inFlight.computeIfAbsent(schedule.getId(), id -> new AtomicBoolean(false));
        JobRuntime runtime = new JobRuntime(schedule, firingService, jobExecutor, executing);
        try {
            if (!runtime.start(taskScheduler, new CronScheduleTrigger(cron))) {
                log.warn("Cron expression '{}' of schedule {} has no upcoming fire time", cron, schedule.getId());
            }
        } catch (RuntimeException e) {
            runtime.stop();
            log.error("Error creating job for schedule {}: {}", schedule.getId(), e.getMessage(), e);
            return false;
        }
        runtimes.put(schedule.getId(), runtime);
        log.info("Created job {} with cron: {}", schedule.getId(), cron);
        return true;
    }

    public List<JobRuntime> liveJobs() {
        return new ArrayList<>(runtimes.values());
    }

    public Optional<JobRuntime> findJob(UUID scheduleId) {
        return Optional.ofNullable(runtimes.get(scheduleId));
    }

    public boolean isRunning() {
        return running;
    }
}
