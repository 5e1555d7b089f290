package io.github.drompincen.pocpilot.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "tenant_ai_configs")
public class TenantAiConfigDocument {

    @Id
    private String tenantId;
    private boolean enabled;
    private String encryptedCredential;
    private Instant createdAt;
    private Instant updatedAt;

    public TenantAiConfigDocument() {}

    public boolean hasCredential() {
        return encryptedCredential != null && !encryptedCredential.isBlank();
    }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getEncryptedCredential() { return encryptedCredential; }
    public void setEncryptedCredential(String encryptedCredential) { this.encryptedCredential = encryptedCredential; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
