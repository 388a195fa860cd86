package com.fiscalpilot.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link NotificationSender} that writes messages to the application log. Wired in when
 * the host provides no real delivery channel.
 */
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void send(String channel, List<String> recipients, String message) {
        log.info("[{}] to {}: {}", channel, recipients, message);
    }
}
