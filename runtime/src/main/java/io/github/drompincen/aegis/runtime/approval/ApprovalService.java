package io.github.drompincen.aegis.runtime.approval;

import io.github.drompincen.aegis.persistence.store.ApprovalTicket;
import io.github.drompincen.aegis.persistence.store.PolicyStore;
import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto;
import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto.ApprovalStatus;
import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import io.github.drompincen.aegis.runtime.audit.AuditService;
import io.github.drompincen.aegis.runtime.config.ApprovalProperties;
import io.github.drompincen.aegis.runtime.error.ApprovalDeniedException;
import io.github.drompincen.aegis.runtime.error.ApprovalInterruptedException;
import io.github.drompincen.aegis.runtime.error.ApprovalPendingException;
import io.github.drompincen.aegis.runtime.error.ApprovalTimedOutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Human-approval workflow for actions the decision engine cannot settle on its own.
 *
 * <p>Both modes share the same lookup over the requests this session opened for
 * the (agent, action) pair. The newest one is resumed if it is pending and
 * replayed if a human decided it within {@link ApprovalProperties#replayWindow()}.
 * A timed-out request is never replayed. Otherwise a request is created
 * (find-or-create in the store, so a pending request opened by another session
 * is joined). Only the caller that actually inserts the request writes the
 * PENDING audit entry.
 *
 * <ul>
 *   <li>{@link #awaitDecision} blocks, polling the store every
 *       {@link ApprovalProperties#pollInterval()}. In BOUNDED mode the request
 *       is force-denied once {@link ApprovalProperties#timeout()} elapses.</li>
 *   <li>{@link #pollOrRequest} never sleeps and signals
 *       {@link ApprovalPendingException} while the request is undecided.</li>
 * </ul>
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    public enum RespondResult {
        RESOLVED,
        NOT_FOUND,
        ALREADY_DECIDED
    }

    private final PolicyStore policyStore;
    private final AuditService auditService;
    private final ApprovalProperties properties;

    public ApprovalService(PolicyStore policyStore, AuditService auditService, ApprovalProperties properties) {
        this.policyStore = policyStore;
        this.auditService = auditService;
        this.properties = properties;
        log.info("Approval session {} (replay window {})", properties.sessionId(), properties.replayWindow());
    }

    /**
     * Blocks until the request for this action is decided.
     *
     * @return id of the approved request
     * @throws ApprovalDeniedException      the request was denied
     * @throws ApprovalTimedOutException    no decision before the deadline of this or another waiter
     * @throws ApprovalInterruptedException the waiting thread was interrupted
     */
    public long awaitDecision(String agentName, String actionName, String argsJson) {
        ApprovalRequestDto request = findOrCreate(agentName, actionName, argsJson);
        long approvalId = request.approvalId();
        if (request.status().isTerminal()) {
            return settle(agentName, actionName, approvalId, request.status(), true);
        }

        Instant deadline = properties.bounded() ? Instant.now().plus(properties.timeout()) : null;
        while (true) {
            ApprovalStatus status = currentStatus(approvalId);
            if (status.isTerminal()) {
                return settle(agentName, actionName, approvalId, status, false);
            }

            if (deadline != null && !Instant.now().isBefore(deadline)) {
                timeOut(agentName, actionName, approvalId);
                // a human decided just before the deadline; loop to honour that decision
                continue;
            }

            sleepUntilNextPoll(agentName, actionName, approvalId, deadline);
        }
    }

    /**
     * Non-blocking variant of {@link #awaitDecision}: checks once and returns.
     *
     * @return id of the approved request
     * @throws ApprovalPendingException   the request is still waiting for a human
     * @throws ApprovalDeniedException    the request was denied
     * @throws ApprovalTimedOutException  BOUNDED mode and the request outlived the timeout,
     *                                    or another caller already timed it out
     */
    public long pollOrRequest(String agentName, String actionName, String argsJson) {
        ApprovalRequestDto request = findOrCreate(agentName, actionName, argsJson);
        long approvalId = request.approvalId();
        if (request.status().isTerminal()) {
            return settle(agentName, actionName, approvalId, request.status(), true);
        }

        ApprovalStatus status = currentStatus(approvalId);
        if (status.isTerminal()) {
            return settle(agentName, actionName, approvalId, status, false);
        }

        if (properties.bounded() && request.createdAt() != null
                && !Instant.now().isBefore(request.createdAt().plus(properties.timeout()))) {
            timeOut(agentName, actionName, approvalId);
            return settle(agentName, actionName, approvalId, currentStatus(approvalId), false);
        }
        throw new ApprovalPendingException(agentName, actionName, approvalId);
    }

    /**
     * Operator decision on a pending request, as issued from the dashboard.
     */
    public RespondResult respond(long approvalId, ApprovalStatus decision) {
        if (!decision.isOperatorDecision()) {
            throw new IllegalArgumentException("Decision must be APPROVED or DENIED");
        }
        Optional<ApprovalStatus> current = policyStore.getApprovalStatus(approvalId);
        if (current.isEmpty()) {
            return RespondResult.NOT_FOUND;
        }
        if (current.get().isTerminal() || !policyStore.decideApproval(approvalId, decision)) {
            return RespondResult.ALREADY_DECIDED;
        }
        log.info("Approval #{} responded with {}", approvalId, decision);
        return RespondResult.RESOLVED;
    }

    public List<ApprovalRequestDto> pending() {
        return policyStore.findPendingApprovals();
    }

    public Optional<ApprovalRequestDto> get(long approvalId) {
        return policyStore.getApproval(approvalId);
    }

    // ---- internals ----

    /**
     * The lookup and the create are two store calls. When a concurrent caller
     * opens a request, gets it decided and finishes in between, this caller
     * misses that decision and opens a fresh PENDING request instead. The
     * outcome is one extra prompt for the reviewer, never an unapproved run.
     */
    private ApprovalRequestDto findOrCreate(String agentName, String actionName, String argsJson) {
        Optional<ApprovalRequestDto> latest =
                policyStore.findLatestApproval(agentName, actionName, properties.sessionId());
        if (latest.isPresent()) {
            ApprovalRequestDto request = latest.get();
            if (isReusable(request)) {
                log.debug("Reusing approval #{} ({}) for {}/{}", request.approvalId(), request.status(),
                        agentName, actionName);
                return request;
            }
            log.debug("Approval #{} ({}) for {}/{} is no longer replayed, requesting again",
                    request.approvalId(), request.status(), agentName, actionName);
        }

        ApprovalTicket ticket = policyStore.createApproval(agentName, actionName, properties.sessionId(), argsJson);
        if (ticket.created()) {
            auditService.record(agentName, actionName, AuditOutcome.PENDING,
                    "Approval #" + ticket.approvalId() + " requested, awaiting human decision.");
            log.info("Created approval request #{} for {}/{}", ticket.approvalId(), agentName, actionName);
        }
        return policyStore.getApproval(ticket.approvalId())
                .orElseThrow(() -> new IllegalStateException("Approval #" + ticket.approvalId()
                        + " vanished right after creation"));
    }

    private boolean isReusable(ApprovalRequestDto request) {
        if (request.status() == ApprovalStatus.PENDING) {
            return true;
        }
        if (!request.status().isOperatorDecision() || request.decidedAt() == null) {
            return false;
        }
        return Instant.now().isBefore(request.decidedAt().plus(properties.replayWindow()));
    }

    private ApprovalStatus currentStatus(long approvalId) {
        return policyStore.getApprovalStatus(approvalId)
                .orElseThrow(() -> new IllegalStateException("Approval #" + approvalId + " no longer exists"));
    }

    private long settle(String agentName, String actionName, long approvalId, ApprovalStatus status,
                        boolean replay) {
        if (status == ApprovalStatus.TIMED_OUT) {
            auditService.record(agentName, actionName, AuditOutcome.TIMED_OUT,
                    "Approval #" + approvalId + " was auto-denied after timing out.");
            throw new ApprovalTimedOutException(agentName, actionName, approvalId, properties.timeout());
        }
        String prefix = replay ? "Approval #" + approvalId + " was already " : "Approval #" + approvalId + " ";
        if (status == ApprovalStatus.APPROVED) {
            auditService.record(agentName, actionName, AuditOutcome.APPROVED,
                    prefix + "approved by human reviewer.");
            return approvalId;
        }
        auditService.record(agentName, actionName, AuditOutcome.DENIED, prefix + "denied by human reviewer.");
        throw new ApprovalDeniedException(agentName, actionName, approvalId);
    }

    private void timeOut(String agentName, String actionName, long approvalId) {
        if (!policyStore.decideApproval(approvalId, ApprovalStatus.TIMED_OUT)) {
            log.debug("Approval #{} was decided before the timeout could close it", approvalId);
            return;
        }
        log.warn("Approval #{} for {}/{} timed out after {}, auto-denied",
                approvalId, agentName, actionName, properties.timeout());
        auditService.record(agentName, actionName, AuditOutcome.TIMED_OUT,
                "Approval #" + approvalId + " timed out after " + properties.timeout() + ", auto-denied.");
        throw new ApprovalTimedOutException(agentName, actionName, approvalId, properties.timeout());
    }

    private void sleepUntilNextPoll(String agentName, String actionName, long approvalId, Instant deadline) {
        Duration wait = properties.pollInterval();
        if (deadline != null) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.compareTo(wait) < 0) {
                wait = remaining.isNegative() ? Duration.ZERO : remaining;
            }
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            auditService.record(agentName, actionName, AuditOutcome.DENIED,
                    "Wait for approval #" + approvalId + " was interrupted.");
            throw new ApprovalInterruptedException(agentName, actionName, approvalId);
        }
    }
}
