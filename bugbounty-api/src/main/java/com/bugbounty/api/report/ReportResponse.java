package com.bugbounty.api.report;

import com.bugbounty.core.domain.Report;

import java.time.Instant;
import java.util.UUID;

public record ReportResponse(
        UUID id,
        String title,
        String description,
        Report.Severity severity,
        Report.Status status,
        UUID programId,
        UUID researcherId,
        Instant createdAt,
        Instant updatedAt
) {

    public static ReportResponse from(Report report) {
        return new ReportResponse(
                report.getId(),
                report.getTitle(),
                report.getDescription(),
                report.getSeverity(),
                report.getStatus(),
                report.getProgramId(),
                report.getResearcherId(),
                report.getCreatedAt(),
                report.getUpdatedAt()
        );
    }
}
