package io.github.drompincen.aegis.protocol.api;

import java.time.Instant;

/**
 * An agent together with its audit counters. {@code riskScore} is the share of
 * its audited calls that were blocked, as a percentage with one decimal.
 */
public record AgentSummaryDto(
        String name,
        String owner,
        AgentStatus status,
        Instant createdAt,
        long totalLogs,
        long blockedCount,
        long allowedCount,
        double riskScore
) {
    public static AgentSummaryDto of(AgentDto agent, long totalLogs, long blockedCount, long allowedCount) {
        double score = totalLogs == 0 ? 0.0 : Math.round(blockedCount * 1000.0 / totalLogs) / 10.0;
        return new AgentSummaryDto(agent.name(), agent.owner(), agent.status(), agent.createdAt(),
                totalLogs, blockedCount, allowedCount, score);
    }
}
