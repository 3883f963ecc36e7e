package com.homeostat.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One entry in a task's conversation history.
 */
public record ChatMessage(
        String role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) implements Serializable {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public ChatMessage {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content, List.of(), null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content, List.of(), null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content, List.of(), null);
    }

    public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(ASSISTANT, content, toolCalls, null);
    }

    public static ChatMessage tool(ToolResult result) {
        return new ChatMessage(TOOL, result.content(), List.of(), result.callId());
    }
}
