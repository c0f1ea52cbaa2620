package io.github.drompincen.aegis.runtime.approval;

import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto;
import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto.ApprovalStatus;
import io.github.drompincen.aegis.protocol.api.AuditLogEntryDto;
import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import io.github.drompincen.aegis.runtime.InMemoryPolicyStore;
import io.github.drompincen.aegis.runtime.approval.ApprovalService.RespondResult;
import io.github.drompincen.aegis.runtime.audit.AuditService;
import io.github.drompincen.aegis.runtime.config.ApprovalProperties;
import io.github.drompincen.aegis.runtime.config.ApprovalProperties.WaitMode;
import io.github.drompincen.aegis.runtime.error.ApprovalDeniedException;
import io.github.drompincen.aegis.runtime.error.ApprovalInterruptedException;
import io.github.drompincen.aegis.runtime.error.ApprovalPendingException;
import io.github.drompincen.aegis.runtime.error.ApprovalTimedOutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ApprovalServiceTest {

    private static final Duration POLL = Duration.ofMillis(20);
    private static final Duration REPLAY_WINDOW = Duration.ofMinutes(15);
    private static final String SESSION = "session-a";

    private InMemoryPolicyStore store;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        store = new InMemoryPolicyStore();
        store.upsertAgent("Support", "ops");
        auditService = new AuditService(store);
    }

    private ApprovalService service(Duration timeout, WaitMode mode) {
        return new ApprovalService(store, auditService,
                new ApprovalProperties(POLL, timeout, mode, REPLAY_WINDOW, SESSION));
    }

    @Test
    void firstCallerCreatesRequestAndAuditsPending() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);

        assertThatThrownBy(() -> service.pollOrRequest("Support", "export", "{\"args\":[]}"))
                .isInstanceOf(ApprovalPendingException.class);

        assertThat(store.approvals("Support", "export")).hasSize(1);
        assertThat(store.outcomes("Support", "export")).containsExactly(AuditOutcome.PENDING);
        assertThat(store.readAudit("Support", 10).get(0).details())
                .contains("Approval #1").contains("awaiting human decision");
    }

    @Test
    void pendingRequestIsResumedNotDuplicated() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);

        for (int i = 0; i < 3; i++) {
            ApprovalPendingException pending = catchThrowableOfType(
                    () -> service.pollOrRequest("Support", "export", "{}"), ApprovalPendingException.class);
            assertThat(pending.getApprovalId()).isEqualTo(1L);
        }

        assertThat(store.approvals("Support", "export")).hasSize(1);
        assertThat(store.outcomes("Support", "export")).containsExactly(AuditOutcome.PENDING);
    }

    @Test
    void approvedRequestIsReplayedWithoutNewRow() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);
        long id = store.createApproval("Support", "export", SESSION, "{}").approvalId();
        store.decideApproval(id, ApprovalStatus.APPROVED);

        assertThat(service.awaitDecision("Support", "export", "{}")).isEqualTo(id);
        assertThat(service.pollOrRequest("Support", "export", "{}")).isEqualTo(id);

        assertThat(store.approvals("Support", "export")).hasSize(1);
        assertThat(store.outcomes("Support", "export"))
                .containsExactly(AuditOutcome.APPROVED, AuditOutcome.APPROVED);
        assertThat(store.readAudit("Support", 1).get(0).details()).contains("was already approved");
    }

    @Test
    void deniedRequestIsReplayedAsDenial() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);
        long id = store.createApproval("Support", "export", SESSION, "{}").approvalId();
        store.decideApproval(id, ApprovalStatus.DENIED);

        assertThatThrownBy(() -> service.awaitDecision("Support", "export", "{}"))
                .isExactlyInstanceOf(ApprovalDeniedException.class);

        assertThat(store.approvals("Support", "export")).hasSize(1);
        assertThat(store.outcomes("Support", "export")).containsExactly(AuditOutcome.DENIED);
    }

    @Test
    void boundedWaitTimesOutAndAutoDenies() {
        ApprovalService service = service(POLL.multipliedBy(2), WaitMode.BOUNDED);

        assertThatThrownBy(() -> service.awaitDecision("Support", "export", "{}"))
                .isInstanceOf(ApprovalTimedOutException.class)
                .isInstanceOf(ApprovalDeniedException.class);

        ApprovalRequestDto request = store.approvals("Support", "export").get(0);
        assertThat(request.status()).isEqualTo(ApprovalStatus.TIMED_OUT);
        assertThat(request.decidedAt()).isNotNull();
        assertThat(store.outcomes("Support", "export"))
                .containsExactly(AuditOutcome.PENDING, AuditOutcome.TIMED_OUT);
    }

    @Test
    void timedOutRequestIsNotReplayedAndOperatorCanApproveTheNextOne() {
        ApprovalService service = service(POLL.multipliedBy(2), WaitMode.BOUNDED);
        assertThatThrownBy(() -> service.awaitDecision("Support", "export", "{}"))
                .isInstanceOf(ApprovalTimedOutException.class);
        assertThat(service.pending()).isEmpty();

        ApprovalPendingException reopened = catchThrowableOfType(
                () -> service.pollOrRequest("Support", "export", "{}"), ApprovalPendingException.class);

        assertThat(reopened.getApprovalId()).isEqualTo(2L);
        assertThat(service.pending()).extracting(ApprovalRequestDto::approvalId).containsExactly(2L);
        assertThat(service.respond(1, ApprovalStatus.APPROVED)).isEqualTo(RespondResult.ALREADY_DECIDED);
        assertThat(service.respond(2, ApprovalStatus.APPROVED)).isEqualTo(RespondResult.RESOLVED);
        assertThat(service.pollOrRequest("Support", "export", "{}")).isEqualTo(2L);
        assertThat(store.outcomes("Support", "export")).containsExactly(
                AuditOutcome.PENDING, AuditOutcome.TIMED_OUT, AuditOutcome.PENDING, AuditOutcome.APPROVED);
    }

    @Test
    void timedOutRequestIsNeverReportedAsHumanDenial() {
        ApprovalService service = service(POLL.multipliedBy(2), WaitMode.BOUNDED);

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> service.awaitDecision("Support", "export", "{}"))
                    .isInstanceOf(ApprovalTimedOutException.class);
        }

        assertThat(store.approvals("Support", "export")).hasSize(3)
                .extracting(ApprovalRequestDto::status).containsOnly(ApprovalStatus.TIMED_OUT);
        assertThat(store.readAudit("Support", 10)).extracting(AuditLogEntryDto::details)
                .noneMatch(details -> details.contains("human reviewer"));
    }

    @Test
    void waiterThatLosesTheTimeoutRaceReportsTimeout() throws Exception {
        ApprovalService service = service(Duration.ofSeconds(30), WaitMode.BOUNDED);

        CompletableFuture<Long> waiter = CompletableFuture.supplyAsync(
                () -> service.awaitDecision("Support", "export", "{}"));
        long id = awaitPendingRequest();
        store.decideApproval(id, ApprovalStatus.TIMED_OUT);

        assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(ApprovalTimedOutException.class);
        assertThat(store.readAudit("Support", 1).get(0).details())
                .isEqualTo("Approval #" + id + " was auto-denied after timing out.");
    }

    @Test
    void decisionIsNotReplayedOnceTheWindowHasPassed() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);
        long id = store.createApproval("Support", "export", SESSION, "{}").approvalId();
        store.decideApproval(id, ApprovalStatus.APPROVED);
        store.backdateDecision(id, Instant.now().minus(REPLAY_WINDOW).minusSeconds(1));

        ApprovalPendingException pending = catchThrowableOfType(
                () -> service.pollOrRequest("Support", "export", "{}"), ApprovalPendingException.class);

        assertThat(pending.getApprovalId()).isGreaterThan(id);
        assertThat(store.approvals("Support", "export")).hasSize(2);
    }

    @Test
    void zeroReplayWindowAsksEveryTime() {
        ApprovalService service = new ApprovalService(store, auditService,
                new ApprovalProperties(POLL, Duration.ofSeconds(5), WaitMode.BOUNDED, Duration.ZERO, SESSION));
        long id = store.createApproval("Support", "export", SESSION, "{}").approvalId();
        store.decideApproval(id, ApprovalStatus.DENIED);

        assertThatThrownBy(() -> service.pollOrRequest("Support", "export", "{}"))
                .isInstanceOf(ApprovalPendingException.class);
    }

    @Test
    void decisionFromAnotherSessionIsNotReplayed() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);
        long earlier = store.createApproval("Support", "export", "previous-process", "{}").approvalId();
        store.decideApproval(earlier, ApprovalStatus.APPROVED);

        ApprovalPendingException pending = catchThrowableOfType(
                () -> service.pollOrRequest("Support", "export", "{}"), ApprovalPendingException.class);

        assertThat(pending.getApprovalId()).isNotEqualTo(earlier);
        assertThat(store.getApproval(pending.getApprovalId()).orElseThrow().sessionId()).isEqualTo(SESSION);
    }

    @Test
    void pendingRequestOfAnotherSessionIsJoined() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);
        long other = store.createApproval("Support", "export", "other-gateway", "{}").approvalId();

        ApprovalPendingException pending = catchThrowableOfType(
                () -> service.pollOrRequest("Support", "export", "{}"), ApprovalPendingException.class);

        assertThat(pending.getApprovalId()).isEqualTo(other);
        assertThat(store.approvals("Support", "export")).hasSize(1);
    }

    @Test
    void missedDecisionDuringLookupFailsClosed() {
        // lookup misses the approved request, as when another caller decided it between the two store calls
        InMemoryPolicyStore lagging = new InMemoryPolicyStore() {
            @Override
            public synchronized Optional<ApprovalRequestDto> findLatestApproval(String agentName,
                                                                                 String actionName,
                                                                                 String sessionId) {
                return Optional.empty();
            }
        };
        ApprovalService service = new ApprovalService(lagging, new AuditService(lagging),
                new ApprovalProperties(POLL, Duration.ofSeconds(5), WaitMode.BOUNDED, REPLAY_WINDOW, SESSION));
        long decided = lagging.createApproval("Support", "export", SESSION, "{}").approvalId();
        lagging.decideApproval(decided, ApprovalStatus.APPROVED);

        ApprovalPendingException pending = catchThrowableOfType(
                () -> service.pollOrRequest("Support", "export", "{}"), ApprovalPendingException.class);

        assertThat(pending.getApprovalId()).isNotEqualTo(decided);
        assertThat(lagging.getApprovalStatus(pending.getApprovalId())).contains(ApprovalStatus.PENDING);
        assertThat(lagging.outcomes("Support", "export")).containsExactly(AuditOutcome.PENDING);
    }

    @Test
    void waiterSeesDecisionMadeWhileWaiting() throws Exception {
        ApprovalService service = service(Duration.ofSeconds(10), WaitMode.BOUNDED);

        CompletableFuture<Long> waiter = CompletableFuture.supplyAsync(
                () -> service.awaitDecision("Support", "export", "{}"));
        long id = awaitPendingRequest();
        assertThat(service.respond(id, ApprovalStatus.APPROVED)).isEqualTo(RespondResult.RESOLVED);

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo(id);
        assertThat(store.outcomes("Support", "export"))
                .containsExactly(AuditOutcome.PENDING, AuditOutcome.APPROVED);
    }

    @Test
    void waiterSeesDenialMadeWhileWaiting() throws Exception {
        ApprovalService service = service(Duration.ofSeconds(10), WaitMode.BOUNDED);

        CompletableFuture<Long> waiter = CompletableFuture.supplyAsync(
                () -> service.awaitDecision("Support", "export", "{}"));
        long id = awaitPendingRequest();
        service.respond(id, ApprovalStatus.DENIED);

        assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ApprovalDeniedException.class);
    }

    @Test
    void unboundedWaitOutlivesTimeout() throws Exception {
        ApprovalService service = service(POLL, WaitMode.UNBOUNDED);

        CompletableFuture<Long> waiter = CompletableFuture.supplyAsync(
                () -> service.awaitDecision("Support", "export", "{}"));
        long id = awaitPendingRequest();
        Thread.sleep(POLL.multipliedBy(5).toMillis());
        assertThat(waiter).isNotDone();

        service.respond(id, ApprovalStatus.APPROVED);
        assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo(id);
        assertThat(store.outcomes("Support", "export")).doesNotContain(AuditOutcome.TIMED_OUT);
    }

    @Test
    void pollOrRequestTimesOutStaleRequest() {
        ApprovalService service = service(Duration.ofMinutes(5), WaitMode.BOUNDED);
        long id = store.createApproval("Support", "export", SESSION, "{}").approvalId();
        store.backdate(id, Instant.now().minus(Duration.ofMinutes(6)));

        assertThatThrownBy(() -> service.pollOrRequest("Support", "export", "{}"))
                .isInstanceOf(ApprovalTimedOutException.class);
        assertThat(store.getApprovalStatus(id)).contains(ApprovalStatus.TIMED_OUT);
    }

    @Test
    void pollOrRequestNeverTimesOutWhenUnbounded() {
        ApprovalService service = service(Duration.ofMinutes(5), WaitMode.UNBOUNDED);
        long id = store.createApproval("Support", "export", SESSION, "{}").approvalId();
        store.backdate(id, Instant.now().minus(Duration.ofHours(6)));

        assertThatThrownBy(() -> service.pollOrRequest("Support", "export", "{}"))
                .isInstanceOf(ApprovalPendingException.class);
        assertThat(store.getApprovalStatus(id)).contains(ApprovalStatus.PENDING);
    }

    @Test
    void respondReportsUnknownAndAlreadyDecided() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);
        long id = store.createApproval("Support", "export", SESSION, "{}").approvalId();

        assertThat(service.respond(99, ApprovalStatus.APPROVED)).isEqualTo(RespondResult.NOT_FOUND);
        assertThat(service.respond(id, ApprovalStatus.DENIED)).isEqualTo(RespondResult.RESOLVED);
        assertThat(service.respond(id, ApprovalStatus.APPROVED)).isEqualTo(RespondResult.ALREADY_DECIDED);
        assertThat(store.getApprovalStatus(id)).contains(ApprovalStatus.DENIED);
    }

    @Test
    void respondRejectsPendingAsDecision() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);

        assertThatThrownBy(() -> service.respond(1, ApprovalStatus.PENDING))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.respond(1, ApprovalStatus.TIMED_OUT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void interruptedWaitIsAuditedAndLeavesRequestPending() throws Exception {
        ApprovalService service = service(Duration.ofSeconds(30), WaitMode.BOUNDED);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread waiter = new Thread(() -> {
            try {
                service.awaitDecision("Support", "export", "{}");
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        waiter.start();
        long id = awaitPendingRequest();
        waiter.interrupt();
        waiter.join(5000);

        assertThat(failure.get()).isInstanceOf(ApprovalInterruptedException.class);
        assertThat(store.getApprovalStatus(id)).contains(ApprovalStatus.PENDING);
        assertThat(store.outcomes("Support", "export"))
                .containsExactly(AuditOutcome.PENDING, AuditOutcome.DENIED);
    }

    @Test
    void pendingListsUndecidedRequests() {
        ApprovalService service = service(Duration.ofSeconds(5), WaitMode.BOUNDED);
        long first = store.createApproval("Support", "export", SESSION, "{}").approvalId();
        long second = store.createApproval("Support", "refund", SESSION, "{}").approvalId();
        store.decideApproval(first, ApprovalStatus.APPROVED);

        assertThat(service.pending()).extracting(ApprovalRequestDto::approvalId).containsExactly(second);
        assertThat(service.get(first)).map(ApprovalRequestDto::status).contains(ApprovalStatus.APPROVED);
    }

    private long awaitPendingRequest() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            for (AuditLogEntryDto entry : store.readAudit("Support", 10)) {
                if (entry.outcome() == AuditOutcome.PENDING) {
                    return store.approvals("Support", entry.actionName()).get(0).approvalId();
                }
            }
            Thread.sleep(5);
        }
        throw new AssertionError("No approval request was created");
    }
}
