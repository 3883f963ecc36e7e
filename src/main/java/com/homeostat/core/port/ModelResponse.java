package com.homeostat.core.port;

import com.homeostat.core.model.ToolCall;

import java.util.List;

public record ModelResponse(String content, List<ToolCall> toolCalls) {

    public ModelResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelResponse text(String content) {
        return new ModelResponse(content, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
