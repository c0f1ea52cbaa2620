package io.github.drompincen.aegis.protocol.api;

import java.time.Instant;

public record AgentDto(
        String name,
        String owner,
        AgentStatus status,
        Instant createdAt
) {}
