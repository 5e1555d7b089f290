package io.github.drompincen.pocpilot.runtime.domain;

import io.github.drompincen.pocpilot.protocol.api.PocStatus;

import java.time.LocalDate;

public record PocSummary(
        String pocId,
        String title,
        String customerCompanyName,
        PocStatus status,
        LocalDate startDate,
        LocalDate endDate,
        Integer overallSuccessScore
) {}
