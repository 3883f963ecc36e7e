package com.homeostat.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Appends every bus event as one JSON line to the {@code homeostat.telemetry} logger,
 * which logback routes to its own file.
 */
@Component
public class TelemetryRecorder {

    private static final Logger log = LoggerFactory.getLogger(TelemetryRecorder.class);
    static final Logger TELEMETRY = LoggerFactory.getLogger("homeostat.telemetry");

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private EventBus.Subscription subscription;

    public TelemetryRecorder(EventBus eventBus, ObjectMapper objectMapper) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::record);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void record(HomeostatEvent event) {
        TELEMETRY.info(toJson(event));
    }

    String toJson(HomeostatEvent event) {
        var line = new LinkedHashMap<String, Object>();
        line.put("event", event.eventType());
        line.put("timestamp", event.timestamp().toString());
        if (event.traceId() != null) {
            line.put("trace_id", event.traceId());
        }
        line.putAll(event.payload());
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            log.warn("Could not encode telemetry event {}: {}", event.eventType(), e.getMessage());
            return objectMapper.createObjectNode()
                    .put("event", event.eventType())
                    .put("encoding_error", e.getOriginalMessage())
                    .toString();
        }
    }
}
