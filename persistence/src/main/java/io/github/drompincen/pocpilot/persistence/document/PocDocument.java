package io.github.drompincen.pocpilot.persistence.document;

import io.github.drompincen.pocpilot.protocol.api.PocStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-side view of a POC. The POC service owns this collection; the assistant only queries it.
 */
@Document(collection = "pocs")
@CompoundIndex(name = "tenant_status", def = "{'tenantId': 1, 'status': 1}")
public class PocDocument {

    @Id
    private String pocId;
    private String tenantId;
    private String title;
    private String customerCompanyName;
    private PocStatus status;
    private String createdBy;
    private List<String> participantIds = new ArrayList<>();
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer overallSuccessScore;
    private Instant updatedAt;

    public PocDocument() {}

    public boolean involves(String userId) {
        return userId != null && (userId.equals(createdBy) || participantIds.contains(userId));
    }

    public String getPocId() { return pocId; }
    public void setPocId(String pocId) { this.pocId = pocId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getCustomerCompanyName() { return customerCompanyName; }
    public void setCustomerCompanyName(String customerCompanyName) { this.customerCompanyName = customerCompanyName; }

    public PocStatus getStatus() { return status; }
    public void setStatus(PocStatus status) { this.status = status; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public List<String> getParticipantIds() { return participantIds; }
    public void setParticipantIds(List<String> participantIds) {
        this.participantIds = participantIds != null ? participantIds : new ArrayList<>();
    }

    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }

    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }

    public Integer getOverallSuccessScore() { return overallSuccessScore; }
    public void setOverallSuccessScore(Integer overallSuccessScore) { this.overallSuccessScore = overallSuccessScore; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
