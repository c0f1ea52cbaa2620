package io.github.drompincen.aegis.protocol.api;

import java.time.Instant;

/**
 * One human-approval request. {@code sessionId} identifies the firewall
 * process that opened it; decisions are only replayed to callers of the
 * same session.
 */
public record ApprovalRequestDto(
        long approvalId,
        String agentName,
        String actionName,
        String sessionId,
        String argsJson,
        ApprovalStatus status,
        Instant createdAt,
        Instant decidedAt
) {
    public enum ApprovalStatus {
        PENDING, APPROVED, DENIED, TIMED_OUT;

        public boolean isTerminal() {
            return this != PENDING;
        }

        /** Only a human reviewer may move a request to APPROVED or DENIED. */
        public boolean isOperatorDecision() {
            return this == APPROVED || this == DENIED;
        }
    }
}
