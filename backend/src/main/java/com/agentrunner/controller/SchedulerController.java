package com.agentrunner.controller;

import com.agentrunner.dto.SchedulePreviewResponse;
import com.agentrunner.dto.LiveJobResponse;
import com.agentrunner.dto.ReconcileResult;
import com.agentrunner.service.SchedulerStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final SchedulerStatusService statusService;

    @GetMapping("/jobs")
    public List<LiveJobResponse> liveJobs() {
        return statusService.liveJobs();
    }

    @PostMapping("/reconcile")
    public ReconcileResult reconcile() {
        return statusService.reconcileNow();
    }

    @GetMapping("/preview")
    public SchedulePreviewResponse preview(@RequestParam String cron) {
        return statusService.preview(cron);
    }
}
