package io.github.drompincen.pocpilot.persistence.document;

import io.github.drompincen.pocpilot.protocol.api.TaskStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "poc_tasks")
@CompoundIndex(name = "tenant_poc", def = "{'tenantId': 1, 'pocId': 1, 'sortOrder': 1}")
public class PocTaskDocument {

    @Id
    private String taskId;
    private String tenantId;
    private String pocId;
    private String title;
    private TaskStatus status;
    private List<String> assigneeIds = new ArrayList<>();
    private LocalDate dueDate;
    private int sortOrder;

    public PocTaskDocument() {}

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getPocId() { return pocId; }
    public void setPocId(String pocId) { this.pocId = pocId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }

    public List<String> getAssigneeIds() { return assigneeIds; }
    public void setAssigneeIds(List<String> assigneeIds) {
        this.assigneeIds = assigneeIds != null ? assigneeIds : new ArrayList<>();
    }

    public LocalDate getDueDate() { return dueDate; }
    public void setDueDate(LocalDate dueDate) { this.dueDate = dueDate; }

    public int getSortOrder() { return sortOrder; }
    public void setSortOrder(int sortOrder) { this.sortOrder = sortOrder; }
}
