package com.agentrunner.service;

import com.agentrunner.model.AgentSchedule;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the schedule table as seen by the runner. Implementations must tolerate concurrent callers.
 */
public interface ScheduleStore {

    List<AgentSchedule> listEnabledSchedules();

    void updateLastFired(UUID scheduleId, LocalDateTime firedAt);
}
