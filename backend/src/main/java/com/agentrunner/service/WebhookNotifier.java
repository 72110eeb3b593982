package com.agentrunner.service;

import com.agentrunner.config.SchedulerConfig;
import com.agentrunner.config.SchedulerProperties;
import com.agentrunner.dto.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * Posts {@code {"title": ..., "content": ...}} to the configured webhook.
 */
@Service
@Slf4j
public class WebhookNotifier implements Notifier {

    private final RestTemplate restTemplate;
    private final SchedulerProperties properties;

    public WebhookNotifier(@Qualifier(SchedulerConfig.NOTIFIER_REST_TEMPLATE) RestTemplate restTemplate,
                           SchedulerProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public void send(Notification notification) {
        String url = properties.getNotifier().getWebhookUrl();
        if (!StringUtils.hasText(url)) {
            log.info("No notification webhook configured, dropping '{}'", notification.title());
            return;
        }
        restTemplate.postForEntity(url, notification, Void.class);
        log.debug("Notification '{}' delivered to {}", notification.title(), url);
    }
}
