package io.github.drompincen.pocpilot.runtime.config;

import io.github.drompincen.pocpilot.persistence.document.TenantAiConfigDocument;
import io.github.drompincen.pocpilot.persistence.repository.TenantAiConfigRepository;
import io.github.drompincen.pocpilot.protocol.api.TenantAiConfigDto;
import io.github.drompincen.pocpilot.runtime.crypto.CredentialCipher;
import io.github.drompincen.pocpilot.runtime.crypto.CredentialCipherException;
import io.github.drompincen.pocpilot.runtime.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-tenant assistant switch and model credential. The credential is stored encrypted and
 * only decrypted on the way to the upstream call.
 */
@Service
public class TenantAiConfigService {

    private static final Logger log = LoggerFactory.getLogger(TenantAiConfigService.class);

    private final TenantAiConfigRepository repository;
    private final CredentialCipher cipher;
    private final SessionRegistry sessionRegistry;
    private final Clock clock;

    public TenantAiConfigService(TenantAiConfigRepository repository, CredentialCipher cipher,
                                 SessionRegistry sessionRegistry, Clock clock) {
        this.repository = repository;
        this.cipher = cipher;
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
    }

    /** A tenant that never configured anything reads as disabled without credential. */
    public TenantAiConfigDto get(String tenantId) {
        requireTenant(tenantId);
        return repository.findById(tenantId)
                .map(TenantAiConfigService::toDto)
                .orElseGet(() -> new TenantAiConfigDto(tenantId, false, false, null));
    }

    /**
     * Updates the switch and, when {@code credential} is non-null, replaces the stored
     * credential. A null credential keeps the current one. Disabling closes every open session
     * of the tenant before returning.
     */
    public TenantAiConfigDto set(String tenantId, boolean enabled, String credential) {
        requireTenant(tenantId);
        if (credential != null && credential.isBlank()) {
            throw new IllegalArgumentException("credential must not be blank; omit it to keep the stored one");
        }
        Instant now = clock.instant();
        TenantAiConfigDocument doc = repository.findById(tenantId).orElseGet(() -> {
            TenantAiConfigDocument fresh = new TenantAiConfigDocument();
            fresh.setTenantId(tenantId);
            fresh.setCreatedAt(now);
            return fresh;
        });
        doc.setEnabled(enabled);
        if (credential != null) {
            doc.setEncryptedCredential(cipher.encrypt(credential.trim()));
        }
        doc.setUpdatedAt(now);
        TenantAiConfigDocument saved = repository.save(doc);
        log.info("Assistant config for tenant {}: enabled={}, credentialReplaced={}",
                tenantId, enabled, credential != null);

        if (!enabled) {
            sessionRegistry.invalidateForTenant(tenantId);
        }
        return toDto(saved);
    }

    /** Removes the stored credential. The tenant's open sessions are closed. */
    public TenantAiConfigDto clearCredential(String tenantId) {
        requireTenant(tenantId);
        Optional<TenantAiConfigDocument> existing = repository.findById(tenantId);
        if (existing.isEmpty()) {
            return new TenantAiConfigDto(tenantId, false, false, null);
        }
        TenantAiConfigDocument doc = existing.get();
        doc.setEncryptedCredential(null);
        doc.setUpdatedAt(clock.instant());
        TenantAiConfigDocument saved = repository.save(doc);
        log.info("Assistant credential cleared for tenant {}", tenantId);
        sessionRegistry.invalidateForTenant(tenantId);
        return toDto(saved);
    }

    /**
     * The plaintext credential, or empty when the tenant is disabled, has none, or the stored
     * value cannot be decrypted.
     */
    public Optional<String> resolveCredential(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) return Optional.empty();
        Optional<TenantAiConfigDocument> doc = repository.findById(tenantId)
                .filter(TenantAiConfigDocument::isEnabled)
                .filter(TenantAiConfigDocument::hasCredential);
        if (doc.isEmpty()) return Optional.empty();
        try {
            return Optional.of(cipher.decrypt(doc.get().getEncryptedCredential()));
        } catch (CredentialCipherException e) {
            log.error("Stored assistant credential for tenant {} cannot be decrypted: {}", tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
    }

    private static TenantAiConfigDto toDto(TenantAiConfigDocument doc) {
        return new TenantAiConfigDto(doc.getTenantId(), doc.isEnabled(), doc.hasCredential(), doc.getUpdatedAt());
    }
}
