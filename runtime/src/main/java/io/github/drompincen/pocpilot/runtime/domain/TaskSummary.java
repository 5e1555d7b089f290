package io.github.drompincen.pocpilot.runtime.domain;

import io.github.drompincen.pocpilot.protocol.api.TaskStatus;

import java.time.LocalDate;
import java.util.List;

public record TaskSummary(
        String taskId,
        String title,
        TaskStatus status,
        LocalDate dueDate,
        List<String> assigneeIds
) {}
