package io.github.drompincen.aegis.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalRequestDtoTest {

    @Test
    void onlyPendingIsNonTerminal() {
        assertThat(ApprovalRequestDto.ApprovalStatus.PENDING.isTerminal()).isFalse();
        assertThat(ApprovalRequestDto.ApprovalStatus.APPROVED.isTerminal()).isTrue();
        assertThat(ApprovalRequestDto.ApprovalStatus.DENIED.isTerminal()).isTrue();
        assertThat(ApprovalRequestDto.ApprovalStatus.TIMED_OUT.isTerminal()).isTrue();
    }

    @Test
    void timeoutIsNotAnOperatorDecision() {
        assertThat(ApprovalRequestDto.ApprovalStatus.APPROVED.isOperatorDecision()).isTrue();
        assertThat(ApprovalRequestDto.ApprovalStatus.DENIED.isOperatorDecision()).isTrue();
        assertThat(ApprovalRequestDto.ApprovalStatus.TIMED_OUT.isOperatorDecision()).isFalse();
        assertThat(ApprovalRequestDto.ApprovalStatus.PENDING.isOperatorDecision()).isFalse();
    }

    @Test
    void auditOutcomeEnumValues() {
        assertThat(AuditOutcome.values()).containsExactly(
                AuditOutcome.ALLOWED, AuditOutcome.BLOCKED, AuditOutcome.KILLED,
                AuditOutcome.PENDING, AuditOutcome.APPROVED, AuditOutcome.DENIED,
                AuditOutcome.TIMED_OUT);
    }
}
