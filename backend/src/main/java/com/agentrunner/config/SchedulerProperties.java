package com.agentrunner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the schedule runner, bound from the {@code scheduler.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Start the runner with the application context.
     */
    private boolean enabled = true;

    /**
     * Delay between two reconciliation passes against the schedule table.
     */
    private Duration reconcileInterval = Duration.ofSeconds(60);

    /**
     * Threads that evaluate cron triggers and run reconciliation.
     */
    private int timerPoolSize = 4;

    /**
     * Core and maximum threads that run the agent executions themselves.
     */
    private int jobPoolSize = 4;

    private int jobPoolMaxSize = 64;

    /**
     * Longest output kept in an execution record.
     */
    private int outputSummaryMaxLength = 2000;

    /**
     * Longest output quoted in a completion notification.
     */
    private int notificationPreviewLength = 200;

    private Executor executor = new Executor();

    private Notifier notifier = new Notifier();

    @Data
    public static class Executor {

        /**
         * Base URL of the agent runtime that executes agent configurations.
         */
        private String baseUrl = "http://localhost:8000";

        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Upper bound on a single agent execution.
         */
        private Duration readTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Notifier {

        /**
         * Webhook receiving completion notifications. Blank disables delivery.
         */
        private String webhookUrl;

        private Duration timeout = Duration.ofSeconds(30);
    }
}
