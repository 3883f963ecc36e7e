package com.homeostat.core.steps;

import com.homeostat.core.governance.EffectiveLimits;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.port.ModelRequest;

import java.util.List;

final class ModelRequests {

    private ModelRequests() {}

    static ModelRequest of(String role, List<ChatMessage> messages, EffectiveLimits limits, List<String> tools) {
        return new ModelRequest(role, messages, limits.maxTokens(), limits.temperature(), limits.timeout(), tools);
    }
}
