package com.bugbounty.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Report - a researcher's vulnerability submission against a program.
 *
 * Status and severity move freely between their values: any value may
 * follow any other, including RESOLVED back to OPEN. The submitting
 * researcher and the target program are fixed at creation.
 */
@Entity
@Table(name = "reports", indexes = {
    @Index(name = "idx_report_program", columnList = "program_id"),
    @Index(name = "idx_report_researcher", columnList = "researcher_id")
})
public class Report {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "title", nullable = false, length = ColumnLengths.TEXT)
    private String title;

    @NotNull
    @Column(name = "description", nullable = false, length = ColumnLengths.TEXT)
    private String description;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private Severity severity;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private Status status;

    @NotNull
    @Column(name = "program_id", nullable = false, updatable = false)
    private UUID programId;

    @NotNull
    @Column(name = "researcher_id", nullable = false, updatable = false)
    private UUID researcherId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL
    }

    public enum Status {
        OPEN,
        IN_REVIEW,
        RESOLVED,
        REJECTED
    }

    protected Report() {}

    /**
     * Files a new report. Starts OPEN with LOW severity.
     */
    public static Report submit(UUID programId, UUID researcherId, String title, String description) {
        if (programId == null) {
            throw new IllegalArgumentException("Program ID is required");
        }
        if (researcherId == null) {
            throw new IllegalArgumentException("Researcher ID is required");
        }
        Report report = new Report();
        report.id = UUID.randomUUID();
        report.programId = programId;
        report.researcherId = researcherId;
        report.title = title;
        report.description = description;
        report.severity = Severity.LOW;
        report.status = Status.OPEN;
        report.createdAt = Instant.now();
        report.updatedAt = report.createdAt;
        return report;
    }

    /**
     * Triage update. Either argument may be null to keep the current value,
     * but not both.
     */
    public void triage(Status status, Severity severity) {
        if (status == null && severity == null) {
            throw new IllegalArgumentException("Status or severity must be provided");
        }
        if (status != null) {
            this.status = status;
        }
        if (severity != null) {
            this.severity = severity;
        }
        this.updatedAt = Instant.now();
    }

    public boolean isSubmittedBy(UUID userId) {
        return researcherId.equals(userId);
    }

    // Getters
    public UUID getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public Severity getSeverity() { return severity; }
    public Status getStatus() { return status; }
    public UUID getProgramId() { return programId; }
    public UUID getResearcherId() { return researcherId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
