package com.agentrunner.service;

import com.agentrunner.dto.JobRequest;

/**
 * Runs the work bound to a schedule. Called from job threads, possibly concurrently for different schedules.
 */
public interface JobExecutor {

    /**
     * @return the raw output of the run
     * @throws RuntimeException of any kind when the run fails
     */
    String execute(JobRequest request);
}
