package io.github.drompincen.pocpilot.persistence.document;

import io.github.drompincen.pocpilot.protocol.api.UserRole;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One user's membership of one tenant, with the role held there.
 */
@Document(collection = "tenant_users")
@CompoundIndex(name = "tenant_user", def = "{'tenantId': 1, 'userId': 1}", unique = true)
public class TenantUserDocument {

    @Id
    private String id;
    private String tenantId;
    private String userId;
    private String fullName;
    private String email;
    private UserRole role;
    private boolean active = true;

    public TenantUserDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getFullName() { return fullName; }
    public void setFullName(String fullName) { this.fullName = fullName; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public UserRole getRole() { return role; }
    public void setRole(UserRole role) { this.role = role; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
