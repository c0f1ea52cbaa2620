package io.github.drompincen.aegis.runtime.context;

/**
 * Handle for one {@link AgentContext#enter(String)} binding. Closing it more
 * than once has no further effect.
 */
public final class AgentScope implements AutoCloseable {

    private final String agentName;
    private final String previous;
    private boolean closed;

    AgentScope(String agentName, String previous) {
        this.agentName = agentName;
        this.previous = previous;
    }

    public String agentName() {
        return agentName;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        AgentContext.restore(previous);
    }
}
