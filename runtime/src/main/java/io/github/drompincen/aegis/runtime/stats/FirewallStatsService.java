package io.github.drompincen.aegis.runtime.stats;

import io.github.drompincen.aegis.persistence.store.PolicyStore;
import io.github.drompincen.aegis.protocol.api.AgentDto;
import io.github.drompincen.aegis.protocol.api.AgentStatus;
import io.github.drompincen.aegis.protocol.api.AgentSummaryDto;
import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import io.github.drompincen.aegis.protocol.api.FirewallStatsDto;
import io.github.drompincen.aegis.protocol.api.RiskLevel;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Dashboard counters, computed from the store on every call.
 */
@Service
public class FirewallStatsService {

    static final Duration RECENT_BLOCKS_WINDOW = Duration.ofHours(24);

    private final PolicyStore policyStore;

    public FirewallStatsService(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    public FirewallStatsDto stats() {
        List<AgentDto> agents = policyStore.listAgents();
        long active = agents.stream().filter(a -> a.status() == AgentStatus.ACTIVE).count();
        long recentBlocks = policyStore.countAudit(null, AuditOutcome.BLOCKED,
                Instant.now().minus(RECENT_BLOCKS_WINDOW));
        return new FirewallStatsDto(agents.size(), active, recentBlocks,
                policyStore.countPendingApprovals(), RiskLevel.forRecentBlocks(recentBlocks));
    }

    public List<AgentSummaryDto> agents() {
        return policyStore.listAgents().stream().map(this::summarize).toList();
    }

    public Optional<AgentSummaryDto> agent(String name) {
        return policyStore.getAgent(name).map(this::summarize);
    }

    private AgentSummaryDto summarize(AgentDto agent) {
        String name = agent.name();
        return AgentSummaryDto.of(agent,
                policyStore.countAudit(name, null, null),
                policyStore.countAudit(name, AuditOutcome.BLOCKED, null),
                policyStore.countAudit(name, AuditOutcome.ALLOWED, null));
    }
}
