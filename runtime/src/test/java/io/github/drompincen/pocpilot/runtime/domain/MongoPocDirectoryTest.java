package io.github.drompincen.pocpilot.runtime.domain;

import io.github.drompincen.pocpilot.persistence.document.PocDocument;
import io.github.drompincen.pocpilot.persistence.document.PocTaskDocument;
import io.github.drompincen.pocpilot.persistence.document.TenantUserDocument;
import io.github.drompincen.pocpilot.persistence.repository.PocRepository;
import io.github.drompincen.pocpilot.persistence.repository.PocTaskRepository;
import io.github.drompincen.pocpilot.persistence.repository.TenantUserRepository;
import io.github.drompincen.pocpilot.protocol.api.PocStatus;
import io.github.drompincen.pocpilot.protocol.api.TaskStatus;
import io.github.drompincen.pocpilot.protocol.api.UserRole;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoPocDirectoryTest {

    @Mock private PocRepository pocRepository;
    @Mock private PocTaskRepository taskRepository;
    @Mock private TenantUserRepository userRepository;

    private MongoPocDirectory directory;

    private final CallerIdentity engineer = new CallerIdentity("t1", "u1", UserRole.SALES_ENGINEER);
    private final CallerIdentity admin = new CallerIdentity("t1", "admin", UserRole.TENANT_ADMIN);

    @BeforeEach
    void setUp() {
        directory = new MongoPocDirectory(pocRepository, taskRepository, userRepository);
        when(pocRepository.findByTenantIdAndStatusOrderByTitleAsc("t1", PocStatus.ACTIVE)).thenReturn(List.of(
                poc("p1", "Alpha", "u1", List.of()),
                poc("p2", "Beta", "someone", List.of("u1")),
                poc("p3", "Gamma", "someone", List.of("u9"))));
    }

    @Test
    void engineerSeesOnlyPocsTheyAreInvolvedIn() {
        List<PocSummary> pocs = directory.activePocs(engineer);

        assertThat(pocs).extracting(PocSummary::title).containsExactly("Alpha", "Beta");
    }

    @Test
    void tenantAdminSeesEveryActivePoc() {
        assertThat(directory.activePocs(admin)).hasSize(3);
    }

    @Test
    void callerWithoutTenantSeesNothing() {
        assertThat(directory.activePocs(new CallerIdentity(null, "u1", UserRole.SALES_ENGINEER))).isEmpty();
        verify(pocRepository, never()).findByTenantIdAndStatusOrderByTitleAsc(any(), any());
    }

    @Test
    void tasksOfInvisiblePocAreNotQueried() {
        when(pocRepository.findByPocIdAndTenantId("p3", "t1"))
                .thenReturn(Optional.of(poc("p3", "Gamma", "someone", List.of("u9"))));

        assertThat(directory.tasks(engineer, "p3")).isEmpty();
        verify(taskRepository, never()).findByTenantIdAndPocIdOrderBySortOrderAsc(anyString(), anyString());
    }

    @Test
    void tasksOfVisiblePoc() {
        when(pocRepository.findByPocIdAndTenantId("p1", "t1"))
                .thenReturn(Optional.of(poc("p1", "Alpha", "u1", List.of())));
        PocTaskDocument task = new PocTaskDocument();
        task.setTaskId("k1");
        task.setTenantId("t1");
        task.setPocId("p1");
        task.setTitle("Install agent");
        task.setStatus(TaskStatus.IN_PROGRESS);
        when(taskRepository.findByTenantIdAndPocIdOrderBySortOrderAsc("t1", "p1")).thenReturn(List.of(task));

        List<TaskSummary> tasks = directory.tasks(engineer, "p1");

        assertThat(tasks).singleElement().satisfies(t -> {
            assertThat(t.title()).isEqualTo("Install agent");
            assertThat(t.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        });
    }

    @Test
    void eligibleUsersLeaveOutCustomers() {
        when(userRepository.findByTenantIdAndActiveTrueOrderByFullNameAsc("t1")).thenReturn(List.of(
                user("u1", "Ana", UserRole.SALES_ENGINEER),
                user("c1", "Carl", UserRole.CUSTOMER)));

        assertThat(directory.eligibleUsers(engineer)).extracting(UserSummary::fullName).containsExactly("Ana");
    }

    private static PocDocument poc(String id, String title, String createdBy, List<String> participants) {
        PocDocument doc = new PocDocument();
        doc.setPocId(id);
        doc.setTenantId("t1");
        doc.setTitle(title);
        doc.setStatus(PocStatus.ACTIVE);
        doc.setCreatedBy(createdBy);
        doc.setParticipantIds(participants);
        return doc;
    }

    private static TenantUserDocument user(String userId, String name, UserRole role) {
        TenantUserDocument doc = new TenantUserDocument();
        doc.setTenantId("t1");
        doc.setUserId(userId);
        doc.setFullName(name);
        doc.setRole(role);
        return doc;
    }
}
