package com.agentrunner.service;

import com.agentrunner.config.SchedulerProperties;
import com.agentrunner.dto.JobRequest;
import com.agentrunner.dto.Notification;
import com.agentrunner.model.AgentSchedule;
import com.agentrunner.model.ScheduleExecution;
import com.agentrunner.model.enums.ExecutionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * The work done for one fire of one schedule: claim the slot, run the agent, record the outcome,
 * notify. Each collaborator call is contained here; nothing thrown by the store, the executor,
 * the execution log or the notifier leaves {@link #fire(AgentSchedule)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleFiringService {

    private static final String ELLIPSIS = "...";

    private final ScheduleStore scheduleStore;
    private final JobExecutor jobExecutor;
    private final ExecutionLog executionLog;
    private final Notifier notifier;
    private final SchedulerProperties properties;

    public ScheduleExecution fire(AgentSchedule schedule) {
        UUID scheduleId = schedule.getId();
        LocalDateTime startedAt = LocalDateTime.now();
        long startNanos = System.nanoTime();

        log.info("Executing schedule {} for agent {}", scheduleId, schedule.getAgentConfigId());

        // 1. Claim the slot first so a reload cannot fire it twice
        try {
            scheduleStore.updateLastFired(scheduleId, startedAt);
        } catch (Exception e) {
            log.warn("Failed to update last fire time for schedule {}: {}", scheduleId, e.getMessage());
        }

        // 2. Run the agent
        ExecutionStatus status;
        String output = null;
        String errorMessage = null;
        try {
            output = jobExecutor.execute(new JobRequest(scheduleId, schedule.getAgentConfigId(), schedule.getInputPayload()));
            status = ExecutionStatus.SUCCESS;
            log.info("Schedule {} executed successfully", scheduleId);
        } catch (Throwable e) {
            status = ExecutionStatus.FAILURE;
            errorMessage = describe(e);
            log.error("Schedule {} execution failed: {}", scheduleId, errorMessage, e);
        }

        long durationMs = Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L);

        ScheduleExecution record = ScheduleExecution.builder()
                .scheduleId(scheduleId)
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now())
                .status(status)
                .durationMs(durationMs)
                .errorMessage(errorMessage)
                .outputSummary(truncate(output, properties.getOutputSummaryMaxLength()))
                .build();

        // 3. Record the outcome
        try {
            executionLog.append(record);
        } catch (Exception e) {
            log.error("Failed to store execution result for schedule {}: {}", scheduleId, e.getMessage(), e);
        }

        // 4. Notify
        if (schedule.shouldNotify()) {
            sendNotification(schedule, record);
        }
        return record;
    }

    private void sendNotification(AgentSchedule schedule, ScheduleExecution record) {
        try {
            notifier.send(summarize(schedule, record, properties.getNotificationPreviewLength()));
        } catch (Exception e) {
            log.error("Failed to send notification for schedule {}: {}", schedule.getId(), e.getMessage());
        }
    }

    static Notification summarize(AgentSchedule schedule, ScheduleExecution record, int previewLength) {
        String subject = "Schedule \"" + schedule.getName() + "\" (" + schedule.getId() + ") for agent "
                + schedule.getAgentConfigId();
        if (record.isSuccess()) {
            String result = record.getOutputSummary() != null ? record.getOutputSummary() : "";
            return new Notification("Schedule Executed Successfully",
                    subject + " completed successfully in " + record.getDurationMs() + " ms.\n\nResult: "
                            + truncate(result, previewLength));
        }
        return new Notification("Schedule Execution Failed",
                subject + " failed.\n\nError: " + record.getErrorMessage());
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + ELLIPSIS;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
