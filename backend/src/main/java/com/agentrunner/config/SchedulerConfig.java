package com.agentrunner.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

@Configuration
@Slf4j
public class SchedulerConfig {

    public static final String TIMER_SCHEDULER = "scheduleTimerScheduler";
    public static final String JOB_EXECUTOR = "scheduleJobExecutor";
    public static final String AGENT_REST_TEMPLATE = "agentRestTemplate";
    public static final String NOTIFIER_REST_TEMPLATE = "notifierRestTemplate";

    @Bean(TIMER_SCHEDULER)
    public ThreadPoolTaskScheduler scheduleTimerScheduler(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getTimerPoolSize());
        scheduler.setThreadNamePrefix("schedule-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Unhandled error on schedule timer thread: {}", t.getMessage(), t));
        return scheduler;
    }

    // Queue capacity 0: a fire either gets a thread or is rejected, never parked behind another job.
    @Bean(JOB_EXECUTOR)
    public ThreadPoolTaskExecutor scheduleJobExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getJobPoolSize());
        executor.setMaxPoolSize(Math.max(properties.getJobPoolSize(), properties.getJobPoolMaxSize()));
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("schedule-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean(AGENT_REST_TEMPLATE)
    public RestTemplate agentRestTemplate(RestTemplateBuilder builder, SchedulerProperties properties) {
        return builder
                .rootUri(properties.getExecutor().getBaseUrl())
                .setConnectTimeout(properties.getExecutor().getConnectTimeout())
                .setReadTimeout(properties.getExecutor().getReadTimeout())
                .build();
    }

    @Bean(NOTIFIER_REST_TEMPLATE)
    public RestTemplate notifierRestTemplate(RestTemplateBuilder builder, SchedulerProperties properties) {
        return builder
                .setConnectTimeout(properties.getNotifier().getTimeout())
                .setReadTimeout(properties.getNotifier().getTimeout())
                .build();
    }
}
