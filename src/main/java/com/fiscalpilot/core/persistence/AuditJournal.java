package com.fiscalpilot.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fiscalpilot.core.events.PipelineEvent;
import com.fiscalpilot.core.events.PipelineEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only JSON Lines journal of pipeline events: one line per approval decision,
 * notification, execution and rollback, keyed by action id and timestamp.
 * <p>
 * A failed append is logged and dropped; the pipeline itself keeps running.
 */
public class AuditJournal {

    private static final Logger log = LoggerFactory.getLogger(AuditJournal.class);

    private final Path path;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private PipelineEventBus.Subscription subscription;

    public AuditJournal(Path path) {
        this.path = path;
    }

    /** Starts journaling every event published on the bus. */
    public synchronized void attach(PipelineEventBus eventBus) {
        if (subscription != null) {
            return;
        }
        subscription = eventBus.subscribeAll(this::append);
        log.info("Audit journal writing to {}", path.toAbsolutePath());
    }

    public synchronized void detach() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    public synchronized void append(PipelineEvent event) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJsonLine(event) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to append {} for action {} to audit journal {}: {}",
                    event.eventType(), event.actionId(), path, e.getMessage(), e);
        }
    }

    String toJsonLine(PipelineEvent event) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", event.timestamp().toString());
        node.put("event", event.eventType());
        node.put("action_id", event.actionId());
        node.put("actor", event.actor());
        node.set("payload", objectMapper.valueToTree(event.payload()));
        return objectMapper.writeValueAsString(node);
    }

    public Path getPath() {
        return path;
    }
}
