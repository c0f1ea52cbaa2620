package io.github.drompincen.aegis.persistence.repository;

import io.github.drompincen.aegis.persistence.document.AgentDocument;
import io.github.drompincen.aegis.protocol.api.AgentStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentRepository extends MongoRepository<AgentDocument, String> {

    List<AgentDocument> findByStatus(AgentStatus status);

    List<AgentDocument> findAllByOrderByNameAsc();
}
