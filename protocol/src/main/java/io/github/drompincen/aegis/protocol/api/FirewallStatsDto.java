package io.github.drompincen.aegis.protocol.api;

public record FirewallStatsDto(
        long registeredAgents,
        long activeAgents,
        long blocksLast24h,
        long pendingApprovals,
        RiskLevel riskLevel
) {}
