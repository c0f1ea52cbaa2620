package io.github.drompincen.aegis.runtime.error;

/**
 * The waiting thread was interrupted. The request itself stays PENDING.
 */
public class ApprovalInterruptedException extends ApprovalDeniedException {

    public ApprovalInterruptedException(String agentName, String actionName, long approvalId) {
        super("Interrupted while waiting for approval #" + approvalId + " of action '" + actionName + "'.",
                agentName, actionName, approvalId);
    }
}
