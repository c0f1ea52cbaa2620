package io.github.drompincen.aegis.runtime.error;

/**
 * A human reviewer rejected the approval request. Subclasses cover the other
 * ways a pending request ends without an approval.
 */
public class ApprovalDeniedException extends AegisException {

    private final long approvalId;

    public ApprovalDeniedException(String agentName, String actionName, long approvalId) {
        this("Approval #" + approvalId + " for action '" + actionName + "' was denied.",
                agentName, actionName, approvalId);
    }

    protected ApprovalDeniedException(String message, String agentName, String actionName, long approvalId) {
        super(message, agentName, actionName);
        this.approvalId = approvalId;
    }

    public long getApprovalId() {
        return approvalId;
    }
}
