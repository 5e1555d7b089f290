package io.github.drompincen.pocpilot.persistence.repository;

import io.github.drompincen.pocpilot.persistence.document.PocDocument;
import io.github.drompincen.pocpilot.protocol.api.PocStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface PocRepository extends MongoRepository<PocDocument, String> {
    List<PocDocument> findByTenantIdAndStatusOrderByTitleAsc(String tenantId, PocStatus status);
    Optional<PocDocument> findByPocIdAndTenantId(String pocId, String tenantId);
}
