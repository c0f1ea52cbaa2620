package io.github.drompincen.aegis.persistence.store;

import io.github.drompincen.aegis.persistence.document.AgentDocument;
import io.github.drompincen.aegis.persistence.document.ApprovalDocument;
import io.github.drompincen.aegis.persistence.document.AuditLogDocument;
import io.github.drompincen.aegis.persistence.document.PolicyDocument;
import io.github.drompincen.aegis.persistence.repository.AgentRepository;
import io.github.drompincen.aegis.persistence.repository.ApprovalRepository;
import io.github.drompincen.aegis.persistence.repository.AuditLogRepository;
import io.github.drompincen.aegis.persistence.repository.PolicyRepository;
import io.github.drompincen.aegis.protocol.api.AgentDto;
import io.github.drompincen.aegis.protocol.api.AgentStatus;
import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto;
import io.github.drompincen.aegis.protocol.api.AuditLogEntryDto;
import io.github.drompincen.aegis.protocol.api.AuditOutcome;
import io.github.drompincen.aegis.protocol.api.PolicyDto;
import io.github.drompincen.aegis.protocol.api.PolicyRule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Service
public class MongoPolicyStore implements PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(MongoPolicyStore.class);
    private static final int MAX_CREATE_ATTEMPTS = 5;

    private final MongoTemplate mongoTemplate;
    private final AgentRepository agentRepository;
    private final PolicyRepository policyRepository;
    private final ApprovalRepository approvalRepository;
    private final AuditLogRepository auditLogRepository;
    private final SequenceGenerator sequenceGenerator;

    public MongoPolicyStore(MongoTemplate mongoTemplate,
                            AgentRepository agentRepository,
                            PolicyRepository policyRepository,
                            ApprovalRepository approvalRepository,
                            AuditLogRepository auditLogRepository,
                            SequenceGenerator sequenceGenerator) {
        this.mongoTemplate = mongoTemplate;
        this.agentRepository = agentRepository;
        this.policyRepository = policyRepository;
        this.approvalRepository = approvalRepository;
        this.auditLogRepository = auditLogRepository;
        this.sequenceGenerator = sequenceGenerator;
    }

    /**
     * Spring Boot leaves automatic index creation off, so every index the
     * queries rely on is declared here. The partial unique index is what makes
     * {@link #createApproval} a true find-or-create: a second PENDING row for
     * the same pair is rejected.
     */
    @PostConstruct
    public void ensureIndexes() {
        mongoTemplate.indexOps(ApprovalDocument.class).ensureIndex(
                new Index().on("agentName", Sort.Direction.ASC)
                        .on("actionName", Sort.Direction.ASC)
                        .unique()
                        .partial(PartialIndexFilter.of(
                                where("status").is(ApprovalRequestDto.ApprovalStatus.PENDING.name())))
                        .named("one_pending_per_action"));
        mongoTemplate.indexOps(ApprovalDocument.class).ensureIndex(
                new Index().on("agentName", Sort.Direction.ASC)
                        .on("actionName", Sort.Direction.ASC)
                        .on("sessionId", Sort.Direction.ASC)
                        .on("_id", Sort.Direction.DESC)
                        .named("agent_action_session_latest"));
        mongoTemplate.indexOps(AuditLogDocument.class).ensureIndex(
                new Index().on("agentName", Sort.Direction.ASC)
                        .on("_id", Sort.Direction.DESC)
                        .named("agent_id"));
        mongoTemplate.indexOps(AuditLogDocument.class).ensureIndex(
                new Index().on("outcome", Sort.Direction.ASC)
                        .on("timestamp", Sort.Direction.DESC)
                        .named("outcome_timestamp"));
        mongoTemplate.indexOps(PolicyDocument.class).ensureIndex(
                new Index().on("agentName", Sort.Direction.ASC)
                        .on("actionName", Sort.Direction.ASC)
                        .unique()
                        .named("agent_action"));
    }

    // ---- Agents ----

    @Override
    public Optional<AgentStatus> getAgentStatus(String name) {
        return agentRepository.findById(name).map(AgentDocument::getStatus);
    }

    @Override
    public Optional<AgentDto> getAgent(String name) {
        return agentRepository.findById(name).map(MongoPolicyStore::toDto);
    }

    @Override
    public List<AgentDto> listAgents() {
        return agentRepository.findAllByOrderByNameAsc().stream().map(MongoPolicyStore::toDto).toList();
    }

    @Override
    public void upsertAgent(String name, String owner) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("owner", owner)
                .set("updatedAt", now)
                .setOnInsert("status", AgentStatus.ACTIVE.name())
                .setOnInsert("createdAt", now);
        mongoTemplate.upsert(query(where("name").is(name)), update, AgentDocument.class);
    }

    @Override
    public boolean updateAgentStatus(String name, AgentStatus status) {
        Update update = new Update().set("status", status.name()).set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query(where("name").is(name)), update, AgentDocument.class)
                .getMatchedCount() > 0;
    }

    // ---- Policies ----

    @Override
    public Optional<PolicyRule> getPolicy(String agentName, String actionName) {
        return policyRepository.findByAgentNameAndActionName(agentName, actionName).map(PolicyDocument::getRule);
    }

    @Override
    public void upsertPolicy(String agentName, String actionName, PolicyRule rule) {
        Update update = new Update()
                .set("agentName", agentName)
                .set("actionName", actionName)
                .set("rule", rule.name())
                .set("updatedAt", Instant.now());
        mongoTemplate.upsert(query(where("policyId").is(PolicyDocument.idFor(agentName, actionName))),
                update, PolicyDocument.class);
    }

    @Override
    public List<PolicyDto> listPolicies(String agentName) {
        return policyRepository.findByAgentNameOrderByActionNameAsc(agentName).stream()
                .map(p -> new PolicyDto(p.getAgentName(), p.getActionName(), p.getRule()))
                .toList();
    }

    // ---- Approvals ----

    @Override
    public ApprovalTicket createApproval(String agentName, String actionName, String sessionId,
                                         String argsJson) {
        Query pending = query(where("agentName").is(agentName)
                .and("actionName").is(actionName)
                .and("status").is(ApprovalRequestDto.ApprovalStatus.PENDING.name()));

        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            long candidateId = sequenceGenerator.next(SequenceGenerator.APPROVALS);
            Update onInsert = new Update()
                    .setOnInsert("approvalId", candidateId)
                    .setOnInsert("sessionId", sessionId)
                    .setOnInsert("argsJson", argsJson)
                    .setOnInsert("createdAt", Instant.now());
            try {
                ApprovalDocument doc = mongoTemplate.findAndModify(pending, onInsert,
                        FindAndModifyOptions.options().upsert(true).returnNew(true), ApprovalDocument.class);
                if (doc != null) {
                    boolean created = doc.getApprovalId() == candidateId;
                    if (created) {
                        log.info("Created approval request #{} for {}/{}", candidateId, agentName, actionName);
                    }
                    return new ApprovalTicket(doc.getApprovalId(), created);
                }
            } catch (DuplicateKeyException e) {
                // Lost the insert race; the winner's row is visible on the next read.
                ApprovalDocument winner = mongoTemplate.findOne(pending, ApprovalDocument.class);
                if (winner != null) {
                    return new ApprovalTicket(winner.getApprovalId(), false);
                }
                log.debug("Approval for {}/{} resolved during create race, retrying (attempt {})",
                        agentName, actionName, attempt);
            }
        }
        throw new IllegalStateException("Could not create or find a pending approval for "
                + agentName + "/" + actionName + " after " + MAX_CREATE_ATTEMPTS + " attempts");
    }

    @Override
    public Optional<ApprovalRequestDto> findLatestApproval(String agentName, String actionName, String sessionId) {
        return approvalRepository
                .findFirstByAgentNameAndActionNameAndSessionIdOrderByApprovalIdDesc(agentName, actionName, sessionId)
                .map(MongoPolicyStore::toDto);
    }

    @Override
    public Optional<ApprovalRequestDto> getApproval(long approvalId) {
        return approvalRepository.findById(approvalId).map(MongoPolicyStore::toDto);
    }

    @Override
    public Optional<ApprovalRequestDto.ApprovalStatus> getApprovalStatus(long approvalId) {
        return approvalRepository.findById(approvalId).map(ApprovalDocument::getStatus);
    }

    @Override
    public boolean decideApproval(long approvalId, ApprovalRequestDto.ApprovalStatus decision) {
        if (!decision.isTerminal()) {
            throw new IllegalArgumentException("Decision must be a terminal status, got " + decision);
        }
        Query stillPending = query(where("approvalId").is(approvalId)
                .and("status").is(ApprovalRequestDto.ApprovalStatus.PENDING.name()));
        Update update = new Update().set("status", decision.name()).set("decidedAt", Instant.now());
        boolean decided = mongoTemplate.updateFirst(stillPending, update, ApprovalDocument.class)
                .getModifiedCount() > 0;
        if (decided) {
            log.info("Approval #{} resolved as {}", approvalId, decision);
        }
        return decided;
    }

    @Override
    public List<ApprovalRequestDto> findPendingApprovals() {
        return approvalRepository.findByStatusOrderByApprovalIdDesc(ApprovalRequestDto.ApprovalStatus.PENDING)
                .stream().map(MongoPolicyStore::toDto).toList();
    }

    @Override
    public long countPendingApprovals() {
        return approvalRepository.countByStatus(ApprovalRequestDto.ApprovalStatus.PENDING);
    }

    // ---- Audit ----

    @Override
    public long appendAudit(String agentName, String actionName, AuditOutcome outcome, String details) {
        AuditLogDocument doc = new AuditLogDocument();
        doc.setId(sequenceGenerator.next(SequenceGenerator.AUDIT_LOG));
        doc.setTimestamp(Instant.now());
        doc.setAgentName(agentName);
        doc.setActionName(actionName);
        doc.setOutcome(outcome);
        doc.setDetails(details);
        auditLogRepository.save(doc);
        return doc.getId();
    }

    @Override
    public List<AuditLogEntryDto> readAudit(String agentName, int limit) {
        if (limit <= 0) return List.of();
        PageRequest newestFirst = PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "id"));
        List<AuditLogDocument> docs = agentName != null
                ? auditLogRepository.findByAgentName(agentName, newestFirst)
                : auditLogRepository.findAllBy(newestFirst);

        List<AuditLogEntryDto> entries = new ArrayList<>(docs.size());
        for (AuditLogDocument d : docs) {
            entries.add(new AuditLogEntryDto(d.getId(), d.getTimestamp(), d.getAgentName(),
                    d.getActionName(), d.getOutcome(), d.getDetails()));
        }
        Collections.reverse(entries);
        return entries;
    }

    @Override
    public long countAudit(String agentName, AuditOutcome outcome, Instant since) {
        Criteria criteria = new Criteria();
        if (agentName != null) criteria.and("agentName").is(agentName);
        if (outcome != null) criteria.and("outcome").is(outcome.name());
        if (since != null) criteria.and("timestamp").gte(since);
        return mongoTemplate.count(query(criteria), AuditLogDocument.class);
    }

    // ---- Mapping ----

    private static AgentDto toDto(AgentDocument doc) {
        return new AgentDto(doc.getName(), doc.getOwner(), doc.getStatus(), doc.getCreatedAt());
    }

    private static ApprovalRequestDto toDto(ApprovalDocument doc) {
        return new ApprovalRequestDto(doc.getApprovalId(), doc.getAgentName(), doc.getActionName(),
                doc.getSessionId(), doc.getArgsJson(), doc.getStatus(), doc.getCreatedAt(), doc.getDecidedAt());
    }
}
