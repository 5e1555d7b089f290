package io.github.drompincen.pocpilot.persistence.repository;

import io.github.drompincen.pocpilot.persistence.document.TenantUserDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TenantUserRepository extends MongoRepository<TenantUserDocument, String> {
    Optional<TenantUserDocument> findByTenantIdAndUserId(String tenantId, String userId);
    List<TenantUserDocument> findByTenantIdAndActiveTrueOrderByFullNameAsc(String tenantId);
}
