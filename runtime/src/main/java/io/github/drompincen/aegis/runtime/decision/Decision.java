package io.github.drompincen.aegis.runtime.decision;

/**
 * Authorization verdict for one (agent, action) check.
 */
public enum Decision {
    ALLOWED,
    BLOCKED,
    /** Agent is paused; overrides every policy rule. */
    KILLED,
    /** REVIEW rule or no rule at all: a human has to decide. */
    NEEDS_APPROVAL
}
