package io.github.drompincen.aegis.runtime.audit;

import io.github.drompincen.aegis.persistence.store.PolicyStore;
import io.github.drompincen.aegis.protocol.api.AuditLogEntryDto;
import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Appends decision outcomes to the audit log and reads them back. Store
 * failures propagate: an outcome must be durable before the caller sees it.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);
    public static final int DEFAULT_LIMIT = 10;

    private final PolicyStore policyStore;

    public AuditService(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    public long record(String agentName, String actionName, AuditOutcome outcome, String details) {
        long id = policyStore.appendAudit(agentName, actionName, outcome, details);
        log.debug("audit #{} {}/{} {}: {}", id, agentName, actionName, outcome, details);
        return id;
    }

    public List<AuditLogEntryDto> recent(String agentName, int limit) {
        return policyStore.readAudit(agentName, limit);
    }
}
