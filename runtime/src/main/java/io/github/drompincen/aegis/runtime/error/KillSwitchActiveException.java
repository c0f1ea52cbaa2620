package io.github.drompincen.aegis.runtime.error;

/**
 * The agent is PAUSED. No approval was requested and the action was never attempted.
 */
public class KillSwitchActiveException extends AegisException {

    public KillSwitchActiveException(String agentName, String actionName) {
        super("Agent '" + agentName + "' is PAUSED. All operations are suspended. "
                + "Revive the agent to reactivate it.", agentName, actionName);
    }
}
