package com.agentrunner.service;

import com.agentrunner.config.SchedulerProperties;
import com.agentrunner.dto.JobRequest;
import com.agentrunner.dto.Notification;
import com.agentrunner.model.AgentSchedule;
import com.agentrunner.model.ScheduleExecution;
import com.agentrunner.model.enums.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleFiringServiceTest {

    @Mock private ScheduleStore scheduleStore;
    @Mock private JobExecutor jobExecutor;
    @Mock private ExecutionLog executionLog;
    @Mock private Notifier notifier;

    private SchedulerProperties properties;
    private ScheduleFiringService service;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        service = new ScheduleFiringService(scheduleStore, jobExecutor, executionLog, notifier, properties);
    }

    @Test
    void fire_success_recordsSuccessWithoutError() {
        AgentSchedule schedule = schedule(false);
        when(jobExecutor.execute(any())).thenReturn("{\"success\":true,\"output\":\"done\"}");

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(record.getScheduleId()).isEqualTo(schedule.getId());
        assertThat(record.getDurationMs()).isGreaterThanOrEqualTo(0L);
        assertThat(record.getErrorMessage()).isNull();
        assertThat(record.getOutputSummary()).isEqualTo("{\"success\":true,\"output\":\"done\"}");
        assertThat(record.getCompletedAt()).isAfterOrEqualTo(record.getStartedAt());
        verify(executionLog).append(record);
        verify(notifier, never()).send(any());
    }

    @Test
    void fire_passesAgentReferenceAndPayloadToExecutor() {
        AgentSchedule schedule = schedule(false);
        when(jobExecutor.execute(any())).thenReturn("ok");

        service.fire(schedule);

        verify(jobExecutor).execute(new JobRequest(schedule.getId(), 42L, "{\"ticker\":\"ACME\"}"));
    }

    @Test
    void fire_updatesLastFiredBeforeExecuting() {
        AgentSchedule schedule = schedule(false);
        when(jobExecutor.execute(any())).thenReturn("ok");

        ScheduleExecution record = service.fire(schedule);

        InOrder order = inOrder(scheduleStore, jobExecutor, executionLog);
        order.verify(scheduleStore).updateLastFired(eq(schedule.getId()), eq(record.getStartedAt()));
        order.verify(jobExecutor).execute(any());
        order.verify(executionLog).append(any());
    }

    @Test
    void fire_executorThrows_recordsFailureWithMessage() {
        AgentSchedule schedule = schedule(false);
        when(jobExecutor.execute(any())).thenThrow(new IllegalStateException("model quota exceeded"));

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(record.getErrorMessage()).isEqualTo("model quota exceeded");
        assertThat(record.getOutputSummary()).isNull();
        verify(executionLog).append(record);
    }

    @Test
    void fire_executorThrowsWithoutMessage_usesExceptionName() {
        AgentSchedule schedule = schedule(false);
        when(jobExecutor.execute(any())).thenThrow(new NullPointerException());

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(record.getErrorMessage()).isEqualTo("NullPointerException");
    }

    @Test
    void fire_executorThrowsError_recordsFailureAndNotifies() {
        AgentSchedule schedule = schedule(true);
        when(jobExecutor.execute(any())).thenThrow(new NoClassDefFoundError("agent/Tool"));

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(record.getErrorMessage()).isEqualTo("agent/Tool");
        verify(executionLog).append(record);
        verify(notifier).send(any(Notification.class));
    }

    @Test
    void fire_lastFiredUpdateFails_stillExecutesAndRecords() {
        AgentSchedule schedule = schedule(false);
        doThrow(new RuntimeException("connection refused")).when(scheduleStore).updateLastFired(any(), any());
        when(jobExecutor.execute(any())).thenReturn("ok");

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        verify(executionLog).append(record);
    }

    @Test
    void fire_executionLogFails_stillNotifies() {
        AgentSchedule schedule = schedule(true);
        when(jobExecutor.execute(any())).thenReturn("ok");
        when(executionLog.append(any())).thenThrow(new RuntimeException("disk full"));

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        verify(notifier).send(any());
    }

    @Test
    void fire_notifierFails_executionStaysSuccessful() {
        AgentSchedule schedule = schedule(true);
        when(jobExecutor.execute(any())).thenReturn("ok");
        doThrow(new RuntimeException("webhook down")).when(notifier).send(any());

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(record.getErrorMessage()).isNull();
    }

    @Test
    void fire_failureWithNotify_sendsFailureSummary() {
        AgentSchedule schedule = schedule(true);
        when(jobExecutor.execute(any())).thenThrow(new RuntimeException("agent crashed"));

        service.fire(schedule);

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notifier).send(captor.capture());
        assertThat(captor.getValue().title()).isEqualTo("Schedule Execution Failed");
        assertThat(captor.getValue().content())
                .contains("\"Daily digest\"")
                .contains(schedule.getId().toString())
                .contains("Error: agent crashed");
    }

    @Test
    void fire_successWithNotify_sendsTruncatedOutput() {
        AgentSchedule schedule = schedule(true);
        properties.setNotificationPreviewLength(5);
        when(jobExecutor.execute(any())).thenReturn("abcdefghij");

        service.fire(schedule);

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notifier).send(captor.capture());
        assertThat(captor.getValue().title()).isEqualTo("Schedule Executed Successfully");
        assertThat(captor.getValue().content()).endsWith("Result: abcde...");
    }

    @Test
    void fire_longOutput_truncatedForStorage() {
        AgentSchedule schedule = schedule(false);
        properties.setOutputSummaryMaxLength(10);
        when(jobExecutor.execute(any())).thenReturn("x".repeat(50));

        ScheduleExecution record = service.fire(schedule);

        assertThat(record.getOutputSummary()).isEqualTo("x".repeat(10) + "...");
    }

    @Test
    void truncate_shortOrNullValues_unchanged() {
        assertThat(ScheduleFiringService.truncate(null, 3)).isNull();
        assertThat(ScheduleFiringService.truncate("abc", 3)).isEqualTo("abc");
        assertThat(ScheduleFiringService.truncate("abcd", 3)).isEqualTo("abc...");
    }

    private static AgentSchedule schedule(boolean notify) {
        return AgentSchedule.builder()
                .id(UUID.randomUUID())
                .name("Daily digest")
                .agentConfigId(42L)
                .inputPayload("{\"ticker\":\"ACME\"}")
                .cronExpression("0 9 * * *")
                .active(true)
                .notifyOnCompletion(notify)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
