package io.github.drompincen.aegis.runtime.registry;

import io.github.drompincen.aegis.persistence.store.PolicyStore;
import io.github.drompincen.aegis.protocol.api.AgentDto;
import io.github.drompincen.aegis.protocol.api.AgentSpec;
import io.github.drompincen.aegis.protocol.api.PolicyDto;
import io.github.drompincen.aegis.protocol.api.PolicyRule;
import io.github.drompincen.aegis.runtime.monitor.MonitoredCallInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declares agents and seeds their policy rules in the store.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final PolicyStore policyStore;
    private final MonitoredCallInterceptor interceptor;

    public AgentRegistry(PolicyStore policyStore, MonitoredCallInterceptor interceptor) {
        this.policyStore = policyStore;
        this.interceptor = interceptor;
    }

    /**
     * Upserts the agent and one rule per listed action. A new agent starts
     * ACTIVE; re-registering keeps whatever status it has (a paused agent
     * stays paused) and overwrites the listed rules.
     *
     * <p>An action named in more than one list gets the most restrictive
     * rule: BLOCK over REVIEW over ALLOW.
     */
    public AgentHandle register(AgentSpec spec) {
        if (spec.name() == null || spec.name().isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }

        Map<String, PolicyRule> rules = new LinkedHashMap<>();
        spec.allows().forEach(a -> rules.put(a, PolicyRule.ALLOW));
        spec.requiresReview().forEach(a -> rules.put(a, PolicyRule.REVIEW));
        spec.blocks().forEach(a -> rules.put(a, PolicyRule.BLOCK));

        policyStore.upsertAgent(spec.name(), spec.owner());
        rules.forEach((action, rule) -> policyStore.upsertPolicy(spec.name(), action, rule));

        log.info("Registered agent '{}' (owner '{}') with {} allow, {} block, {} review rules",
                spec.name(), spec.owner(), spec.allows().size(), spec.blocks().size(),
                spec.requiresReview().size());
        return new AgentHandle(spec.name(), interceptor);
    }

    public Optional<AgentDto> find(String name) {
        return policyStore.getAgent(name);
    }

    public List<PolicyDto> policies(String name) {
        return policyStore.listPolicies(name);
    }
}
