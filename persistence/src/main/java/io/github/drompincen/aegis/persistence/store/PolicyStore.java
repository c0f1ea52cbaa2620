package io.github.drompincen.aegis.persistence.store;

import io.github.drompincen.aegis.protocol.api.AgentDto;
import io.github.drompincen.aegis.protocol.api.AgentStatus;
import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto;
import io.github.drompincen.aegis.protocol.api.AuditLogEntryDto;
import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import io.github.drompincen.aegis.protocol.api.PolicyDto;
import io.github.drompincen.aegis.protocol.api.PolicyRule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Single source of truth for agents, policy rules, approval requests and the
 * audit log. Every read goes to the backing store; implementations must not
 * cache agent status or rules.
 *
 * <p>Atomicity the callers rely on:
 * <ul>
 *   <li>{@link #createApproval} is a find-or-create against the PENDING request
 *       of the (agent, action) pair, whatever session opened it; concurrent
 *       callers converge on one row.</li>
 *   <li>{@link #decideApproval} moves a request out of PENDING at most once.</li>
 *   <li>approval and audit ids are assigned by the store and increase monotonically.</li>
 * </ul>
 */
public interface PolicyStore {

    // ---- Agents ----

    Optional<AgentStatus> getAgentStatus(String name);

    Optional<AgentDto> getAgent(String name);

    List<AgentDto> listAgents();

    /** Inserts the agent as ACTIVE, or refreshes its owner leaving the status untouched. */
    void upsertAgent(String name, String owner);

    /** @return false when no agent with that name exists */
    boolean updateAgentStatus(String name, AgentStatus status);

    // ---- Policies ----

    Optional<PolicyRule> getPolicy(String agentName, String actionName);

    void upsertPolicy(String agentName, String actionName, PolicyRule rule);

    List<PolicyDto> listPolicies(String agentName);

    // ---- Approvals ----

    /** Joins the pending request of the pair, or opens one stamped with {@code sessionId}. */
    ApprovalTicket createApproval(String agentName, String actionName, String sessionId, String argsJson);

    /** Newest request of the pair opened by {@code sessionId}, in any status. */
    Optional<ApprovalRequestDto> findLatestApproval(String agentName, String actionName, String sessionId);

    Optional<ApprovalRequestDto> getApproval(long approvalId);

    Optional<ApprovalRequestDto.ApprovalStatus> getApprovalStatus(long approvalId);

    /** @return true if this call resolved the request, false if it was already decided or missing */
    boolean decideApproval(long approvalId, ApprovalRequestDto.ApprovalStatus decision);

    List<ApprovalRequestDto> findPendingApprovals();

    long countPendingApprovals();

    // ---- Audit ----

    long appendAudit(String agentName, String actionName, AuditOutcome outcome, String details);

    /** Last {@code limit} entries, oldest first; {@code agentName} may be null for all agents. */
    List<AuditLogEntryDto> readAudit(String agentName, int limit);

    /** Counts audit entries; every filter may be null to match all. */
    long countAudit(String agentName, AuditOutcome outcome, Instant since);
}
