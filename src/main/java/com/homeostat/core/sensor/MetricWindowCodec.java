package com.homeostat.core.sensor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * JSON form of a {@link MetricWindow}, used for exports and status output.
 */
@Component
public class MetricWindowCodec {

    private final ObjectMapper objectMapper;

    @Autowired
    public MetricWindowCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static MetricWindowCodec withDefaults() {
        return new MetricWindowCodec(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public String toJson(MetricWindow window) {
        try {
            return objectMapper.writeValueAsString(window);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metric window", e);
        }
    }

    public MetricWindow fromJson(String json) {
        try {
            return objectMapper.readValue(json, MetricWindow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize metric window", e);
        }
    }
}
