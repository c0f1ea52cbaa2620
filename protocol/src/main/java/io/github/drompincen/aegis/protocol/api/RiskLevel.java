package io.github.drompincen.aegis.protocol.api;

/**
 * Dashboard risk banner, derived from the number of blocked actions in the
 * last 24 hours.
 */
public enum RiskLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    public static RiskLevel forRecentBlocks(long blocks) {
        if (blocks <= 0) return LOW;
        if (blocks <= 5) return MEDIUM;
        if (blocks <= 20) return HIGH;
        return CRITICAL;
    }
}
