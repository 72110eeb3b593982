package com.agentrunner.controller;

import com.agentrunner.dto.ScheduleExecutionResponse;
import com.agentrunner.service.ExecutionHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionHistoryService historyService;

    @GetMapping("/{scheduleId}/executions")
    public List<ScheduleExecutionResponse> history(@PathVariable UUID scheduleId,
                                                   @RequestParam(defaultValue = "20") int limit) {
        return historyService.findRecent(scheduleId, limit);
    }
}
