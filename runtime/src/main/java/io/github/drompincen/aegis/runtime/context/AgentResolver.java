package io.github.drompincen.aegis.runtime.context;

import io.github.drompincen.aegis.runtime.error.AgentConfigurationException;
import org.springframework.stereotype.Component;

/**
 * Decides which agent a monitored call runs as: an explicitly bound name wins,
 * then the ambient {@link AgentContext}. An unresolvable identity fails the call.
 */
@Component
public class AgentResolver {

    public String resolve(String boundAgentName, String actionName) {
        if (boundAgentName != null && !boundAgentName.isBlank()) {
            return boundAgentName;
        }
        return AgentContext.current().orElseThrow(() -> new AgentConfigurationException(actionName));
    }
}
