package io.github.drompincen.aegis.protocol.api;

public enum AgentStatus {
    ACTIVE,
    PAUSED
}
