package com.homeostat.core.adapter;

import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.port.SessionPort;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime session store. History is lost on restart.
 */
public class InMemorySessionAdapter implements SessionPort {

    private final ConcurrentHashMap<String, List<ChatMessage>> sessions = new ConcurrentHashMap<>();

    @Override
    public List<ChatMessage> load(String sessionId) {
        if (sessionId == null) {
            return List.of();
        }
        return sessions.getOrDefault(sessionId, List.of());
    }

    @Override
    public void save(String sessionId, List<ChatMessage> messages) {
        if (sessionId != null) {
            sessions.put(sessionId, List.copyOf(messages));
        }
    }

    public int size() {
        return sessions.size();
    }
}
