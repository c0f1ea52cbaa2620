package io.github.drompincen.aegis.runtime.error;

/**
 * Base type for every failure the firewall raises to the caller of a monitored action.
 */
public abstract class AegisException extends RuntimeException {

    private final String agentName;
    private final String actionName;

    protected AegisException(String message, String agentName, String actionName) {
        super(message);
        this.agentName = agentName;
        this.actionName = actionName;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getActionName() {
        return actionName;
    }
}
