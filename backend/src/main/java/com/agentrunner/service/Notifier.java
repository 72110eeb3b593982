package com.agentrunner.service;

import com.agentrunner.dto.Notification;

/**
 * Side channel told about finished executions. Callers treat every failure as non-fatal.
 */
public interface Notifier {

    void send(Notification notification);
}
