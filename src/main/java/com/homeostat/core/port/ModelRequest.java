package com.homeostat.core.port;

import com.homeostat.core.model.ChatMessage;

import java.time.Duration;
import java.util.List;

/**
 * One chat completion request.
 *
 * @param role        model role, e.g. {@code standard} or {@code planner}
 * @param maxTokens   token budget, or {@code null} for the backend default
 * @param temperature sampling temperature, or {@code null} for the backend default
 * @param timeout     how long the backend may take
 * @param tools       names of the tools the model may ask for
 */
public record ModelRequest(
        String role,
        List<ChatMessage> messages,
        Integer maxTokens,
        Double temperature,
        Duration timeout,
        List<String> tools
) {

    public ModelRequest {
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
