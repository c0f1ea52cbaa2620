package io.github.drompincen.aegis.persistence.document;

import io.github.drompincen.aegis.protocol.api.PolicyRule;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "policies")
public class PolicyDocument {

    @Id
    private String policyId;         // "<agentName>::<actionName>"
    private String agentName;
    private String actionName;
    private PolicyRule rule;
    private Instant updatedAt;

    public PolicyDocument() {}

    public static String idFor(String agentName, String actionName) {
        return agentName + "::" + actionName;
    }

    public String getPolicyId() { return policyId; }
    public void setPolicyId(String policyId) { this.policyId = policyId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public String getActionName() { return actionName; }
    public void setActionName(String actionName) { this.actionName = actionName; }

    public PolicyRule getRule() { return rule; }
    public void setRule(PolicyRule rule) { this.rule = rule; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
