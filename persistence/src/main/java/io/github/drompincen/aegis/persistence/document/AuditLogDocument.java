package io.github.drompincen.aegis.persistence.document;

import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only record of one authorization event. Ids come from the
 * {@code audit_log} counter, so sorting by id is insertion order.
 * Indexes are created by {@code MongoPolicyStore#ensureIndexes}.
 */
@Document(collection = "audit_log")
public class AuditLogDocument {

    @Id
    private Long id;
    private Instant timestamp;
    private String agentName;
    private String actionName;
    private AuditOutcome outcome;
    private String details;

    public AuditLogDocument() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public String getActionName() { return actionName; }
    public void setActionName(String actionName) { this.actionName = actionName; }

    public AuditOutcome getOutcome() { return outcome; }
    public void setOutcome(AuditOutcome outcome) { this.outcome = outcome; }

    public String getDetails() { return details; }
    public void setDetails(String details) { this.details = details; }
}
