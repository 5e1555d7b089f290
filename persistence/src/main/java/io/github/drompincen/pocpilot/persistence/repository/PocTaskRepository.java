package io.github.drompincen.pocpilot.persistence.repository;

import io.github.drompincen.pocpilot.persistence.document.PocTaskDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PocTaskRepository extends MongoRepository<PocTaskDocument, String> {
    List<PocTaskDocument> findByTenantIdAndPocIdOrderBySortOrderAsc(String tenantId, String pocId);
}
