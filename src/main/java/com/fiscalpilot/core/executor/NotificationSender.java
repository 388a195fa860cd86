package com.fiscalpilot.core.executor;

import java.util.List;

/**
 * Delivery port for outbound messages (email, chat). Sending is irrevocable.
 */
public interface NotificationSender {

    /**
     * @throws ExecutorException when the channel refuses the message
     */
    void send(String channel, List<String> recipients, String message);
}
