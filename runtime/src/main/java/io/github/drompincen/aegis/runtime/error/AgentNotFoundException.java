package io.github.drompincen.aegis.runtime.error;

public class AgentNotFoundException extends AegisException {

    public AgentNotFoundException(String agentName) {
        super("Agent '" + agentName + "' is not registered.", agentName, null);
    }
}
