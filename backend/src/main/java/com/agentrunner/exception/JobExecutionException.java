package com.agentrunner.exception;

/**
 * Raised by a {@link com.agentrunner.service.JobExecutor} when the agent run itself reports a failure.
 */
public class JobExecutionException extends RuntimeException {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
