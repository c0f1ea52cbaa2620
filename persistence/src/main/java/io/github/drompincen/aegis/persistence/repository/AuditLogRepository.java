package io.github.drompincen.aegis.persistence.repository;

import io.github.drompincen.aegis.persistence.document.AuditLogDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AuditLogRepository extends MongoRepository<AuditLogDocument, Long> {
    List<AuditLogDocument> findByAgentName(String agentName, Pageable pageable);
    List<AuditLogDocument> findAllBy(Pageable pageable);
}
