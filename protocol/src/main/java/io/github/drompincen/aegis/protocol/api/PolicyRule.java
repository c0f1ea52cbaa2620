package io.github.drompincen.aegis.protocol.api;

public enum PolicyRule {
    ALLOW,
    BLOCK,
    REVIEW
}
