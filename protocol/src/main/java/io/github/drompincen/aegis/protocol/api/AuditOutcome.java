package io.github.drompincen.aegis.protocol.api;

/**
 * Outcome recorded for a single authorization event. One logical action can
 * produce several entries, e.g. {@code PENDING} followed by {@code APPROVED}.
 */
public enum AuditOutcome {
    ALLOWED,
    BLOCKED,
    KILLED,
    PENDING,
    APPROVED,
    DENIED,
    TIMED_OUT
}
