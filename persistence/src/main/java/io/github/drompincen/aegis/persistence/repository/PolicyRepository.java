package io.github.drompincen.aegis.persistence.repository;

import io.github.drompincen.aegis.persistence.document.PolicyDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface PolicyRepository extends MongoRepository<PolicyDocument, String> {
    Optional<PolicyDocument> findByAgentNameAndActionName(String agentName, String actionName);
    List<PolicyDocument> findByAgentNameOrderByActionNameAsc(String agentName);
}
