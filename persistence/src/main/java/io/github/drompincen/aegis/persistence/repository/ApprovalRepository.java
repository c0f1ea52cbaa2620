package io.github.drompincen.aegis.persistence.repository;

import io.github.drompincen.aegis.persistence.document.ApprovalDocument;
import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ApprovalRepository extends MongoRepository<ApprovalDocument, Long> {
    Optional<ApprovalDocument> findFirstByAgentNameAndActionNameAndSessionIdOrderByApprovalIdDesc(
            String agentName, String actionName, String sessionId);
    List<ApprovalDocument> findByStatusOrderByApprovalIdDesc(ApprovalRequestDto.ApprovalStatus status);
    long countByStatus(ApprovalRequestDto.ApprovalStatus status);
    long countByAgentNameAndActionName(String agentName, String actionName);
}
