package io.github.drompincen.pocpilot.persistence.repository;

import io.github.drompincen.pocpilot.persistence.document.TenantAiConfigDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface TenantAiConfigRepository extends MongoRepository<TenantAiConfigDocument, String> {
}
