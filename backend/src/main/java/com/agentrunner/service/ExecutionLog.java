package com.agentrunner.service;

import com.agentrunner.model.ScheduleExecution;

import java.util.UUID;

/**
 * Append-only sink for execution records.
 */
public interface ExecutionLog {

    UUID append(ScheduleExecution record);
}
