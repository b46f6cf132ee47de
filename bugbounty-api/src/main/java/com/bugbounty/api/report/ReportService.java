package com.bugbounty.api.report;

import com.bugbounty.api.error.ResourceIds;
import com.bugbounty.api.error.ResourceNotFoundException;
import com.bugbounty.api.error.ValidationException;
import com.bugbounty.api.security.AccessPolicy;
import com.bugbounty.core.domain.Program;
import com.bugbounty.core.domain.Report;
import com.bugbounty.core.domain.User;
import com.bugbounty.core.repository.ProgramRepository;
import com.bugbounty.core.repository.ReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Service for vulnerability report submission, visibility and triage.
 *
 * Every read or mutation of a report resolves its parent program first, so
 * the ownership gate always sees the company that owns the report.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    static final String REPORT_NOT_FOUND = "Report not found";
    static final String PROGRAM_NOT_FOUND = "Program not found";

    private final ReportRepository reportRepository;
    private final ProgramRepository programRepository;
    private final AccessPolicy accessPolicy;

    public ReportService(
            ReportRepository reportRepository,
            ProgramRepository programRepository,
            AccessPolicy accessPolicy) {
        this.reportRepository = reportRepository;
        this.programRepository = programRepository;
        this.accessPolicy = accessPolicy;
    }

    /**
     * Files a new report as the acting researcher. New reports start OPEN
     * with LOW severity.
     */
    @Transactional
    public Report submit(User actor, String programId, String title, String description) {
        if (isBlank(programId) || isBlank(title) || isBlank(description)) {
            throw new ValidationException("Program ID, title, and description are required");
        }

        Program program = loadProgram(programId);
        Report report = reportRepository.save(Report.submit(program.getId(), actor.getId(), title, description));

        log.info("Researcher {} submitted report {} to program {}", actor.getId(), report.getId(), program.getId());
        return report;
    }

    /**
     * Reports of one program as seen by the actor: a company owning the
     * program sees all of them, anyone else only their own submissions.
     */
    @Transactional(readOnly = true)
    public List<Report> listForProgram(User actor, String programId) {
        Program program = loadProgram(programId);

        switch (accessPolicy.reportVisibility(actor, program)) {
            case ALL:
                return reportRepository.findByProgramIdOrderByCreatedAtAsc(program.getId());
            case OWN_SUBMISSIONS:
            default:
                return reportRepository.findByProgramIdAndResearcherIdOrderByCreatedAtAsc(
                        program.getId(), actor.getId());
        }
    }

    @Transactional(readOnly = true)
    public Report get(User actor, String reportId) {
        Report report = loadReport(reportId);
        accessPolicy.requireViewer(actor, report, parentOf(report));
        return report;
    }

    /**
     * Changes status and/or severity of a report. Only the company owning
     * the parent program may do this; any status may follow any other.
     */
    @Transactional
    public Report triage(User actor, String reportId, Report.Status status, Report.Severity severity) {
        if (status == null && severity == null) {
            throw new ValidationException("Status or severity must be provided");
        }

        Report report = loadReport(reportId);
        accessPolicy.requireOwner(actor, parentOf(report), "You are not authorized to update this report");

        Report.Status previous = report.getStatus();
        report.triage(status, severity);
        report = reportRepository.save(report);

        log.info("Report {} triaged by {}: {} -> {}, severity {}",
                report.getId(), actor.getId(), previous, report.getStatus(), report.getSeverity());
        return report;
    }

    private Program loadProgram(String programId) {
        UUID id = ResourceIds.parse(programId, PROGRAM_NOT_FOUND);
        return programRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(PROGRAM_NOT_FOUND));
    }

    private Report loadReport(String reportId) {
        UUID id = ResourceIds.parse(reportId, REPORT_NOT_FOUND);
        return reportRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(REPORT_NOT_FOUND));
    }

    // reports are deleted with their program, so a dangling reference is a data error
    private Program parentOf(Report report) {
        return programRepository.findById(report.getProgramId())
                .orElseThrow(() -> new IllegalStateException(
                        "Report " + report.getId() + " references missing program " + report.getProgramId()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
