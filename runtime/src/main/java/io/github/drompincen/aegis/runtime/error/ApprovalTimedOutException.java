package io.github.drompincen.aegis.runtime.error;

import java.time.Duration;

public class ApprovalTimedOutException extends ApprovalDeniedException {

    public ApprovalTimedOutException(String agentName, String actionName, long approvalId, Duration timeout) {
        super("Approval #" + approvalId + " for action '" + actionName + "' received no decision within "
                + timeout + " and was auto-denied.", agentName, actionName, approvalId);
    }
}
