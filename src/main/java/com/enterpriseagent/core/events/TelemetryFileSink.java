package com.enterpriseagent.core.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;

/**
 * Appends every published {@link AgentEvent} to a JSON-lines file.
 */
@Component
public class TelemetryFileSink {

    private static final Logger log = LoggerFactory.getLogger(TelemetryFileSink.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final EventBus.Subscription subscription;

    public TelemetryFileSink(TelemetryProperties properties, EventBus eventBus, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        String configured = properties.getFile();
        if (configured == null || configured.isBlank()) {
            this.file = null;
            this.subscription = null;
            return;
        }
        this.file = Path.of(configured);
        this.subscription = eventBus.subscribeAll(this::write);
        log.info("Telemetry events written to {}", file.toAbsolutePath());
    }

    synchronized void write(AgentEvent event) {
        var line = new LinkedHashMap<String, Object>();
        line.put("timestamp", event.timestamp().toString());
        line.put("event", event.eventType());
        line.put("runId", event.runId());
        line.put("payload", event.payload());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, objectMapper.writeValueAsString(line) + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Failed to write telemetry event {} to {}: {}", event.eventType(), file, e.getMessage());
        }
    }

    public boolean isEnabled() {
        return subscription != null;
    }

    @PreDestroy
    void close() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }
}
