package io.github.drompincen.aegis.runtime.context;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Ambient "current agent" for the executing thread. Bindings nest: each
 * {@link #enter(String)} returns a scope that restores the previous value when
 * closed, so try-with-resources keeps the binding exact even when the block throws.
 *
 * <pre>{@code
 * try (AgentScope scope = AgentContext.enter("FraudBot")) {
 *     lookupBalance.call();   // resolves to FraudBot
 * }
 * }</pre>
 *
 * Threads never share a binding. Work handed to an executor does not inherit
 * it; use {@link #bind(Callable)} to carry the caller's agent across.
 */
public final class AgentContext {

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private AgentContext() {}

    public static Optional<String> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static AgentScope enter(String agentName) {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName must not be blank");
        }
        String previous = CURRENT.get();
        CURRENT.set(agentName);
        return new AgentScope(agentName, previous);
    }

    /**
     * Captures the current binding (if any) and re-establishes it around
     * {@code task} on whichever thread eventually runs it.
     */
    public static <T> Callable<T> bind(Callable<T> task) {
        String captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (AgentScope ignored = enter(captured)) {
                return task.call();
            }
        };
    }

    static void restore(String previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
