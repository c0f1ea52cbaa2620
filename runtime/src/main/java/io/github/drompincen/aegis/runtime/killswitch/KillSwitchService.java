package io.github.drompincen.aegis.runtime.killswitch;

import io.github.drompincen.aegis.persistence.store.PolicyStore;
import io.github.drompincen.aegis.protocol.api.AgentStatus;
import io.github.drompincen.aegis.runtime.error.AgentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator control over an agent's status. A flip is a single store write and
 * is picked up by the next decision for that agent; callers already waiting on
 * an approval are not interrupted.
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    private final PolicyStore policyStore;

    public KillSwitchService(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    public void pause(String agentName) {
        setStatus(agentName, AgentStatus.PAUSED);
        log.warn("Agent '{}' has been PAUSED", agentName);
    }

    public void revive(String agentName) {
        setStatus(agentName, AgentStatus.ACTIVE);
        log.info("Agent '{}' has been REVIVED", agentName);
    }

    public AgentStatus status(String agentName) {
        return policyStore.getAgentStatus(agentName).orElseThrow(() -> new AgentNotFoundException(agentName));
    }

    private void setStatus(String agentName, AgentStatus status) {
        if (!policyStore.updateAgentStatus(agentName, status)) {
            throw new AgentNotFoundException(agentName);
        }
    }
}
