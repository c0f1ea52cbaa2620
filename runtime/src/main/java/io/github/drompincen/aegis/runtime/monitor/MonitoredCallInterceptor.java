package io.github.drompincen.aegis.runtime.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import io.github.drompincen.aegis.runtime.approval.ApprovalService;
import io.github.drompincen.aegis.runtime.audit.AuditService;
import io.github.drompincen.aegis.runtime.context.AgentResolver;
import io.github.drompincen.aegis.runtime.decision.Decision;
import io.github.drompincen.aegis.runtime.decision.DecisionEngine;
import io.github.drompincen.aegis.runtime.error.AegisException;
import io.github.drompincen.aegis.runtime.error.ApprovalDeniedException;
import io.github.drompincen.aegis.runtime.error.ApprovalTimedOutException;
import io.github.drompincen.aegis.runtime.error.KillSwitchActiveException;
import io.github.drompincen.aegis.runtime.error.PolicyBlockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Runs an action only after the firewall has authorized it.
 *
 * <p>Per call: resolve the agent, ask the {@link DecisionEngine}, route
 * NEEDS_APPROVAL through the {@link ApprovalService}, then execute. Every
 * terminal outcome is written to the audit log before the caller sees it, and
 * the injected {@link DecisionObserver} is told about it afterwards.
 *
 * <p>Exceptions thrown by the action itself propagate untouched; the ALLOWED
 * audit entry is still written because authorization did succeed.
 */
@Service
public class MonitoredCallInterceptor {

    private static final Logger log = LoggerFactory.getLogger(MonitoredCallInterceptor.class);
    private static final Object[] NO_ARGS = new Object[0];

    private final DecisionEngine decisionEngine;
    private final ApprovalService approvalService;
    private final AuditService auditService;
    private final AgentResolver agentResolver;
    private final DecisionObserver observer;
    private final ObjectMapper objectMapper;

    public MonitoredCallInterceptor(DecisionEngine decisionEngine,
                                    ApprovalService approvalService,
                                    AuditService auditService,
                                    AgentResolver agentResolver,
                                    DecisionObserver observer,
                                    ObjectMapper objectMapper) {
        this.decisionEngine = decisionEngine;
        this.approvalService = approvalService;
        this.auditService = auditService;
        this.agentResolver = agentResolver;
        this.observer = observer;
        this.objectMapper = objectMapper;
    }

    // ---- Wrapping ----

    /** Wraps {@code callable}; the agent is resolved from {@code AgentContext} on each call. */
    public <T> Callable<T> wrap(String actionName, Callable<T> callable) {
        return wrap(null, actionName, callable);
    }

    /** Wraps {@code callable} bound to {@code agentName}; a null name falls back to the ambient agent. */
    public <T> Callable<T> wrap(String agentName, String actionName, Callable<T> callable) {
        return () -> invoke(agentName, actionName, NO_ARGS, callable::call);
    }

    /** Wraps a one-argument function; its input is captured in the approval request. */
    public <I, O> Function<I, O> wrapFunction(String agentName, String actionName, Function<I, O> function) {
        return input -> invoke(agentName, actionName, new Object[]{input},
                (MonitoredAction<O, RuntimeException>) () -> function.apply(input));
    }

    // ---- Invocation ----

    /** Blocking invocation: waits for a human decision when one is needed. */
    public <T, E extends Exception> T invoke(String agentName, String actionName, Object[] args,
                                             MonitoredAction<T, E> action) throws E {
        return intercept(agentName, actionName, args, action, true);
    }

    /**
     * Retry-later invocation: instead of waiting for a human it throws
     * {@link io.github.drompincen.aegis.runtime.error.ApprovalPendingException}
     * so the caller can do other work and call again.
     */
    public <T, E extends Exception> T tryInvoke(String agentName, String actionName, Object[] args,
                                                MonitoredAction<T, E> action) throws E {
        return intercept(agentName, actionName, args, action, false);
    }

    private <T, E extends Exception> T intercept(String agentName, String actionName, Object[] args,
                                                 MonitoredAction<T, E> action, boolean blocking) throws E {
        String agent = agentResolver.resolve(agentName, actionName);
        Decision decision = decisionEngine.decide(agent, actionName);

        switch (decision) {
            case KILLED -> {
                auditService.record(agent, actionName, AuditOutcome.KILLED, "Agent '" + agent + "' is PAUSED.");
                throw substitute(agent, actionName, AuditOutcome.KILLED,
                        new KillSwitchActiveException(agent, actionName));
            }
            case BLOCKED -> {
                auditService.record(agent, actionName, AuditOutcome.BLOCKED,
                        "Action '" + actionName + "' is blocked by policy.");
                throw substitute(agent, actionName, AuditOutcome.BLOCKED,
                        new PolicyBlockedException(agent, actionName));
            }
            case NEEDS_APPROVAL -> awaitApproval(agent, actionName, args, blocking);
            case ALLOWED -> log.debug("{}/{} allowed by policy", agent, actionName);
        }

        return execute(agent, actionName, action);
    }

    private void awaitApproval(String agent, String actionName, Object[] args, boolean blocking) {
        String argsJson = snapshot(args);
        try {
            if (blocking) {
                approvalService.awaitDecision(agent, actionName, argsJson);
            } else {
                approvalService.pollOrRequest(agent, actionName, argsJson);
            }
        } catch (ApprovalTimedOutException e) {
            notifyObserver(agent, actionName, AuditOutcome.TIMED_OUT);
            throw e;
        } catch (ApprovalDeniedException e) {
            notifyObserver(agent, actionName, AuditOutcome.DENIED);
            throw e;
        }
    }

    private <T, E extends Exception> T execute(String agent, String actionName, MonitoredAction<T, E> action)
            throws E {
        boolean completed = false;
        try {
            T result = action.run();
            completed = true;
            return result;
        } finally {
            if (completed) {
                auditService.record(agent, actionName, AuditOutcome.ALLOWED,
                        "Action '" + actionName + "' executed successfully.");
            } else {
                recordAllowedAfterFailure(agent, actionName);
            }
            notifyObserver(agent, actionName, AuditOutcome.ALLOWED);
        }
    }

    /** The action's own exception is what the caller must see, so an audit failure here is only logged. */
    private void recordAllowedAfterFailure(String agent, String actionName) {
        try {
            auditService.record(agent, actionName, AuditOutcome.ALLOWED,
                    "Action '" + actionName + "' was authorized but raised an error.");
        } catch (RuntimeException auditError) {
            log.error("Failed to audit authorized call {}/{} after the action failed", agent, actionName, auditError);
        }
    }

    // ---- Observer ----

    private RuntimeException substitute(String agent, String actionName, AuditOutcome outcome,
                                        AegisException defaultError) {
        Optional<RuntimeException> replacement = notifyObserver(agent, actionName, outcome);
        if (replacement.isEmpty()) {
            return defaultError;
        }
        RuntimeException alt = replacement.get();
        alt.addSuppressed(defaultError);
        return alt;
    }

    private Optional<RuntimeException> notifyObserver(String agent, String actionName, AuditOutcome outcome) {
        try {
            Optional<RuntimeException> result = observer.onDecision(agent, actionName, outcome);
            return result != null ? result : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Decision observer failed for {}/{} {}: {}", agent, actionName, outcome, e.getMessage(), e);
            return Optional.empty();
        }
    }

    // ---- Argument snapshot ----

    String snapshot(Object[] args) {
        Object[] values = args != null ? args : NO_ARGS;
        try {
            return objectMapper.writeValueAsString(Map.of("args", values));
        } catch (JsonProcessingException e) {
            log.debug("Arguments not serializable as JSON, storing their string form: {}", e.getMessage());
            return objectMapper.createObjectNode().put("args", Arrays.toString(values)).toString();
        }
    }
}
