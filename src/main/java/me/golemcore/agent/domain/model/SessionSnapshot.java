package me.golemcore.agent.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a session.
 */
@Value
@Builder
public class SessionSnapshot {

    String sessionId;
    Instant createdAt;
    Instant lastInteraction;
    SessionConfig config;
    List<Message> history;
    String summary;
}
