package io.github.drompincen.aegis.runtime.monitor;

import io.github.drompincen.aegis.protocol.api.AuditOutcome;

import java.util.Optional;

/**
 * Notified of every terminal decision the interceptor makes: ALLOWED, BLOCKED,
 * KILLED, DENIED and TIMED_OUT.
 *
 * <p>For BLOCKED and KILLED the observer may return an exception to raise
 * instead of the default {@link io.github.drompincen.aegis.runtime.error.AegisException}
 * (for example a framework-specific tool error). The return value is ignored
 * for every other outcome.
 */
@FunctionalInterface
public interface DecisionObserver {

    DecisionObserver NOOP = (agentName, actionName, outcome) -> Optional.empty();

    Optional<RuntimeException> onDecision(String agentName, String actionName, AuditOutcome outcome);
}
