package io.github.drompincen.aegis.protocol.api;

public record PolicyDto(
        String agentName,
        String actionName,
        PolicyRule rule
) {}
