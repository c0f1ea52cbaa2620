package io.github.drompincen.aegis.runtime.error;

public class PolicyBlockedException extends AegisException {

    public PolicyBlockedException(String agentName, String actionName) {
        super("Action '" + actionName + "' is blocked by policy for agent '" + agentName + "'.",
                agentName, actionName);
    }
}
