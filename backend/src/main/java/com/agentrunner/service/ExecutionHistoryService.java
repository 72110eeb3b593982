package com.agentrunner.service;

import com.agentrunner.dto.ScheduleExecutionResponse;
import com.agentrunner.exception.NotFoundException;
import com.agentrunner.model.ScheduleExecution;
import com.agentrunner.repository.AgentScheduleRepository;
import com.agentrunner.repository.ScheduleExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ExecutionHistoryService {

    public static final int MAX_LIMIT = 100;

    private final AgentScheduleRepository scheduleRepository;
    private final ScheduleExecutionRepository executionRepository;

    /**
     * Most recent executions of a schedule, newest first.
     */
    @Transactional(readOnly = true)
    public List<ScheduleExecutionResponse> findRecent(UUID scheduleId, int limit) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new NotFoundException("Schedule not found: " + scheduleId);
        }
        int size = Math.min(Math.max(limit, 1), MAX_LIMIT);
        return executionRepository.findByScheduleIdOrderByStartedAtDesc(scheduleId, PageRequest.of(0, size)).stream()
                .map(this::toResponse)
                .toList();
    }

    private ScheduleExecutionResponse toResponse(ScheduleExecution execution) {
        return ScheduleExecutionResponse.builder()
                .id(execution.getId().toString())
                .scheduleId(execution.getScheduleId().toString())
                .status(execution.getStatus().name())
                .startedAt(execution.getStartedAt())
                .completedAt(execution.getCompletedAt())
                .durationMs(execution.getDurationMs())
                .errorMessage(execution.getErrorMessage())
                .outputSummary(execution.getOutputSummary())
                .build();
    }
}
