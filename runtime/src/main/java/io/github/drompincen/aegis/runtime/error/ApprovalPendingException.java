package io.github.drompincen.aegis.runtime.error;

/**
 * Retry signal from the non-blocking approval mode: the request exists but no
 * one has decided it yet. Not a denial.
 */
public class ApprovalPendingException extends AegisException {

    private final long approvalId;

    public ApprovalPendingException(String agentName, String actionName, long approvalId) {
        super("Action '" + actionName + "' is awaiting human approval (request #" + approvalId
                + "). Retry later.", agentName, actionName);
        this.approvalId = approvalId;
    }

    public long getApprovalId() {
        return approvalId;
    }
}
