package com.fiscalpilot.core.executor;

import com.fiscalpilot.core.model.ExecutionResult;
import com.fiscalpilot.core.model.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Sends reminders and review flags through a {@link NotificationSender}.
 * <p>
 * Parameters: {@code recipients} and/or {@code channel} (default "email"), optional
 * {@code message} (defaults to the action description). A sent message cannot be
 * recalled, so results never offer rollback.
 */
public class NotificationExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(NotificationExecutor.class);

    public static final String NAME = "notification";
    private static final int MESSAGE_PREVIEW_CHARS = 200;

    private final NotificationSender sender;

    public NotificationExecutor(NotificationSender sender) {
        this.sender = sender;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Sends notifications and reminders";
    }

    @Override
    public Set<String> supportedActionTypes() {
        return Set.of("send_reminder", "flag_for_review");
    }

    @Override
    public ValidationResult validate(ProposedAction action) {
        String channel = action.stringParameter("channel");
        if (action.stringListParameter("recipients").isEmpty() && (channel == null || channel.isBlank())) {
            return ValidationResult.invalid("Missing required parameter: recipients or channel");
        }
        return ValidationResult.ok();
    }

    @Override
    public ExecutionResult execute(ProposedAction action, boolean dryRun) {
        List<String> recipients = action.stringListParameter("recipients");
        String channel = action.stringParameter("channel");
        if (channel == null || channel.isBlank()) {
            channel = "email";
        }
        String message = action.stringParameter("message");
        if (message == null) {
            message = action.getDescription();
        }

        String summary;
        if (dryRun) {
            summary = String.format("Would send %s notification to %d recipient(s)", channel, recipients.size());
        } else {
            sender.send(channel, recipients, message);
            summary = String.format("Sent %s notification to %d recipient(s)", channel, recipients.size());
            log.info(summary);
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("channel", channel);
        details.put("recipients", recipients);
        details.put("message", message.length() > MESSAGE_PREVIEW_CHARS
                ? message.substring(0, MESSAGE_PREVIEW_CHARS) : message);

        return ExecutionResult.completed(action.getId(), summary, details, dryRun, false);
    }
}
