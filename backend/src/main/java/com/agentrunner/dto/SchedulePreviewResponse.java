package com.agentrunner.dto;

import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Upcoming fire times of a cron expression, evaluated the way the runner would schedule it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchedulePreviewResponse {
    private String cronExpression;
    private String timeZone;
    private boolean valid;
    private String error;
    private List<LocalDateTime> nextFireTimes;
}
