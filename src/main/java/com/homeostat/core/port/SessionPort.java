package com.homeostat.core.port;

import com.homeostat.core.model.ChatMessage;

import java.util.List;

/**
 * Conversation history carried between requests of the same session.
 */
public interface SessionPort {

    /** Messages of {@code sessionId}; empty for an unknown session. */
    List<ChatMessage> load(String sessionId);

    void save(String sessionId, List<ChatMessage> messages);
}
