package com.agentrunner.dto;

import java.util.UUID;

/**
 * What a firing asks the executor to run.
 */
public record JobRequest(UUID scheduleId, Long agentConfigId, String inputPayload) {
}
