package io.github.drompincen.aegis.runtime.decision;

import io.github.drompincen.aegis.persistence.store.PolicyStore;
import io.github.drompincen.aegis.protocol.api.AgentStatus;
import io.github.drompincen.aegis.protocol.api.PolicyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Stateless check that maps (agent, action) to a {@link Decision}. Status and
 * rule are read from the store on every call, so a kill-switch flip or policy
 * edit applies to the very next check.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final PolicyStore policyStore;

    public DecisionEngine(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    public Decision decide(String agentName, String actionName) {
        Optional<AgentStatus> status = policyStore.getAgentStatus(agentName);
        if (status.isPresent() && status.get() == AgentStatus.PAUSED) {
            log.debug("{}/{} -> KILLED", agentName, actionName);
            return Decision.KILLED;
        }

        PolicyRule rule = policyStore.getPolicy(agentName, actionName).orElse(null);
        Decision decision;
        if (rule == PolicyRule.BLOCK) {
            decision = Decision.BLOCKED;
        } else if (rule == PolicyRule.ALLOW) {
            decision = Decision.ALLOWED;
        } else {
            decision = Decision.NEEDS_APPROVAL;
        }
        log.debug("{}/{} rule={} -> {}", agentName, actionName, rule, decision);
        return decision;
    }
}
