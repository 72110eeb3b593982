package com.agentrunner.service;

import com.agentrunner.dto.SchedulePreviewResponse;
import com.agentrunner.dto.LiveJobResponse;
import com.agentrunner.dto.ReconcileResult;
import com.agentrunner.model.AgentSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
public class SchedulerStatusService {

    private static final int PREVIEW_COUNT = 5;

    private final ScheduleRunner scheduleRunner;

    public List<LiveJobResponse> liveJobs() {
        LocalDateTime now = LocalDateTime.now();
        return scheduleRunner.liveJobs().stream()
                .map(job -> toResponse(job, now))
                .sorted(Comparator.comparing(LiveJobResponse::getScheduleId))
                .toList();
    }

    public ReconcileResult reconcileNow() {
        return scheduleRunner.tick();
    }

    // ── Cron preview ──────────────────────────────────────────────────────

    public SchedulePreviewResponse preview(String cronExpression) {
        try {
            CronSchedule cron = CronSchedule.parse(cronExpression);
            List<LocalDateTime> fireTimes = new ArrayList<>();
            LocalDateTime next = LocalDateTime.now();
            for (int i = 0; i < PREVIEW_COUNT; i++) {
                next = cron.next(next);
                if (next == null) break;
                fireTimes.add(next);
            }
            return SchedulePreviewResponse.builder()
                    .cronExpression(cron.getExpression())
                    .timeZone(ZoneId.systemDefault().getId())
                    .valid(true)
                    .nextFireTimes(fireTimes)
                    .build();
        } catch (IllegalArgumentException e) {
            return SchedulePreviewResponse.builder()
                    .cronExpression(cronExpression)
                    .valid(false)
                    .error(e.getMessage())
                    .build();
        }
    }

    private LiveJobResponse toResponse(JobRuntime job, LocalDateTime now) {
        AgentSchedule schedule = job.getSchedule();
        return LiveJobResponse.builder()
                .scheduleId(job.getScheduleId().toString())
                .name(schedule.getName())
                .agentConfigId(schedule.getAgentConfigId())
                .cronExpression(job.getRecurrenceFingerprint())
                .executing(job.isExecuting())
                .skippedFires(job.getSkippedFires())
                .lastFiredAt(job.getLastFiredAt() != null ? job.getLastFiredAt() : schedule.getLastFiredAt())
                .nextFireAt(CronSchedule.parse(job.getRecurrenceFingerprint()).next(now))
                .build();
    }
}
