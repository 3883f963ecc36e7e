package com.homeostat.core.adapter;

import java.util.List;
import java.util.Map;

/**
 * Structured answer a model gives when it wants tools run before replying.
 */
public record ToolRequest(String content, List<RequestedCall> toolCalls) {

    public record RequestedCall(String id, String name, Map<String, Object> arguments) {}
}
