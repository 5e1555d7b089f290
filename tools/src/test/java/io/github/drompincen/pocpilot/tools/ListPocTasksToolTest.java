package io.github.drompincen.pocpilot.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.pocpilot.protocol.api.PocStatus;
import io.github.drompincen.pocpilot.protocol.api.TaskStatus;
import io.github.drompincen.pocpilot.protocol.api.UserRole;
import io.github.drompincen.pocpilot.runtime.domain.PocDirectory;
import io.github.drompincen.pocpilot.runtime.domain.PocSummary;
import io.github.drompincen.pocpilot.runtime.domain.TaskSummary;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import io.github.drompincen.pocpilot.runtime.tools.ToolContext;
import io.github.drompincen.pocpilot.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ListPocTasksToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private PocDirectory pocDirectory;

    private ListPocTasksTool tool;
    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        tool = new ListPocTasksTool();
        tool.setPocDirectory(pocDirectory);
        ctx = new ToolContext(new CallerIdentity("t1", "u1", UserRole.SALES_ENGINEER), "session-1");
    }

    @Test
    void inputSchemaRequiresPocId() throws Exception {
        assertThat(MAPPER.writeValueAsString(tool.inputSchema())).contains("pocId");
    }

    @Test
    void failsWithoutPocId() {
        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("pocId");
        verifyNoInteractions(pocDirectory);
    }

    @Test
    void invisiblePocIsReportedAsNotFound() {
        when(pocDirectory.visiblePoc(ctx.caller(), "p9")).thenReturn(Optional.empty());

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("pocId", "p9"));

        assertThat(result.success()).isFalse();
        verify(pocDirectory, never()).tasks(any(), any());
    }

    @Test
    void listsTasksInOrder() {
        when(pocDirectory.visiblePoc(ctx.caller(), "p1"))
                .thenReturn(Optional.of(new PocSummary("p1", "Alpha", "Acme", PocStatus.ACTIVE, null, null, null)));
        when(pocDirectory.tasks(ctx.caller(), "p1")).thenReturn(List.of(
                new TaskSummary("k1", "Kickoff", TaskStatus.COMPLETED, null, List.of("u1")),
                new TaskSummary("k2", "Install", TaskStatus.IN_PROGRESS, null, List.of())));

        ObjectNode input = MAPPER.createObjectNode().put("pocId", "p1");
        ToolResult result = tool.execute(ctx, input);

        assertThat(result.success()).isTrue();
        assertThat(result.output().path("count").asInt()).isEqualTo(2);
        assertThat(result.output().path("tasks").get(0).path("title").asText()).isEqualTo("Kickoff");
        assertThat(result.output().path("tasks").get(1).path("status").asText()).isEqualTo("IN_PROGRESS");
    }
}
