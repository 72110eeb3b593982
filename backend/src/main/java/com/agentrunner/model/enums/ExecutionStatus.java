package com.agentrunner.model.enums;

public enum ExecutionStatus {
    SUCCESS,
    FAILURE
}
