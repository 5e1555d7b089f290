package io.github.drompincen.pocpilot.runtime.domain;

import io.github.drompincen.pocpilot.persistence.document.PocDocument;
import io.github.drompincen.pocpilot.persistence.document.PocTaskDocument;
import io.github.drompincen.pocpilot.persistence.document.TenantUserDocument;
import io.github.drompincen.pocpilot.persistence.repository.PocRepository;
import io.github.drompincen.pocpilot.persistence.repository.PocTaskRepository;
import io.github.drompincen.pocpilot.persistence.repository.TenantUserRepository;
import io.github.drompincen.pocpilot.protocol.api.PocStatus;
import io.github.drompincen.pocpilot.protocol.api.UserRole;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class MongoPocDirectory implements PocDirectory {

    private final PocRepository pocRepository;
    private final PocTaskRepository taskRepository;
    private final TenantUserRepository userRepository;

    public MongoPocDirectory(PocRepository pocRepository,
                             PocTaskRepository taskRepository,
                             TenantUserRepository userRepository) {
        this.pocRepository = pocRepository;
        this.taskRepository = taskRepository;
        this.userRepository = userRepository;
    }

    @Override
    public List<PocSummary> activePocs(CallerIdentity caller) {
        if (!caller.hasTenant()) return List.of();
        return pocRepository.findByTenantIdAndStatusOrderByTitleAsc(caller.tenantId(), PocStatus.ACTIVE).stream()
                .filter(poc -> canSee(caller, poc))
                .map(MongoPocDirectory::toSummary)
                .toList();
    }

    @Override
    public Optional<PocSummary> visiblePoc(CallerIdentity caller, String pocId) {
        return visibleDocument(caller, pocId).map(MongoPocDirectory::toSummary);
    }

    @Override
    public List<TaskSummary> tasks(CallerIdentity caller, String pocId) {
        if (visibleDocument(caller, pocId).isEmpty()) return List.of();
        return taskRepository.findByTenantIdAndPocIdOrderBySortOrderAsc(caller.tenantId(), pocId).stream()
                .map(MongoPocDirectory::toSummary)
                .toList();
    }

    @Override
    public List<UserSummary> eligibleUsers(CallerIdentity caller) {
        if (!caller.hasTenant()) return List.of();
        return userRepository.findByTenantIdAndActiveTrueOrderByFullNameAsc(caller.tenantId()).stream()
                .filter(u -> u.getRole() != null && u.getRole().isAssistantEligible())
                .map(MongoPocDirectory::toSummary)
                .toList();
    }

    private Optional<PocDocument> visibleDocument(CallerIdentity caller, String pocId) {
        if (!caller.hasTenant() || pocId == null || pocId.isBlank()) return Optional.empty();
        return pocRepository.findByPocIdAndTenantId(pocId, caller.tenantId())
                .filter(poc -> canSee(caller, poc));
    }

    private static boolean canSee(CallerIdentity caller, PocDocument poc) {
        UserRole role = caller.role();
        return caller.tenantId().equals(poc.getTenantId())
                && (role.seesWholeTenant() || poc.involves(caller.userId()));
    }

    private static PocSummary toSummary(PocDocument poc) {
        return new PocSummary(poc.getPocId(), poc.getTitle(), poc.getCustomerCompanyName(), poc.getStatus(),
                poc.getStartDate(), poc.getEndDate(), poc.getOverallSuccessScore());
    }

    private static TaskSummary toSummary(PocTaskDocument task) {
        return new TaskSummary(task.getTaskId(), task.getTitle(), task.getStatus(), task.getDueDate(),
                List.copyOf(task.getAssigneeIds()));
    }

    private static UserSummary toSummary(TenantUserDocument user) {
        return new UserSummary(user.getUserId(), user.getFullName(), user.getEmail(), user.getRole());
    }
}
