package io.github.drompincen.aegis.runtime.error;

public class AgentConfigurationException extends AegisException {

    public AgentConfigurationException(String actionName) {
        super("Monitored action '" + actionName + "': no agent name was bound and no agent context is set. "
                + "Bind an agent when wrapping the action or enter an AgentContext scope.", null, actionName);
    }
}
