package io.github.drompincen.aegis.protocol.api;

import java.time.Instant;

public record AuditLogEntryDto(
        long id,
        Instant timestamp,
        String agentName,
        String actionName,
        AuditOutcome outcome,
        String details
) {}
