package io.github.drompincen.aegis.persistence.document;

import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Indexes are created by {@code MongoPolicyStore#ensureIndexes}.
 */
@Document(collection = "approvals")
public class ApprovalDocument {

    @Id
    private Long approvalId;
    private String agentName;
    private String actionName;
    private String sessionId;
    private String argsJson;
    private ApprovalRequestDto.ApprovalStatus status;
    private Instant createdAt;
    private Instant decidedAt;

    public ApprovalDocument() {}

    public Long getApprovalId() { return approvalId; }
    public void setApprovalId(Long approvalId) { this.approvalId = approvalId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public String getActionName() { return actionName; }
    public void setActionName(String actionName) { this.actionName = actionName; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getArgsJson() { return argsJson; }
    public void setArgsJson(String argsJson) { this.argsJson = argsJson; }

    public ApprovalRequestDto.ApprovalStatus getStatus() { return status; }
    public void setStatus(ApprovalRequestDto.ApprovalStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getDecidedAt() { return decidedAt; }
    public void setDecidedAt(Instant decidedAt) { this.decidedAt = decidedAt; }
}
