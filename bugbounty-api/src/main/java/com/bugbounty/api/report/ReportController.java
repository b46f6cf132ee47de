package com.bugbounty.api.report;

import com.bugbounty.core.domain.Report;
import com.bugbounty.core.domain.User;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for vulnerability reports.
 *
 * Endpoints:
 * - POST /api/reports - Submit a report (RESEARCHER)
 * - GET /api/reports/program/{programId} - Reports of a program, filtered by caller
 * - GET /api/reports/{id} - One report (submitter or owning company)
 * - PATCH /api/reports/{id}/status - Triage a report (owning COMPANY)
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping
    public ResponseEntity<ReportResponse> submit(
            @AuthenticationPrincipal User actor,
            @RequestBody SubmitReportRequest request) {
        Report report = reportService.submit(actor, request.programId(), request.title(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReportResponse.from(report));
    }

    @GetMapping("/program/{programId}")
    public ResponseEntity<List<ReportResponse>> listForProgram(
            @AuthenticationPrincipal User actor,
            @PathVariable String programId) {
        return ResponseEntity.ok(reportService.listForProgram(actor, programId).stream()
                .map(ReportResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReportResponse> get(
            @AuthenticationPrincipal User actor,
            @PathVariable String id) {
        return ResponseEntity.ok(ReportResponse.from(reportService.get(actor, id)));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<ReportResponse> triage(
            @AuthenticationPrincipal User actor,
            @PathVariable String id,
            @RequestBody TriageRequest request) {
        Report report = reportService.triage(actor, id, request.status(), request.severity());
        return ResponseEntity.ok(ReportResponse.from(report));
    }

    public record SubmitReportRequest(
            String programId,
            String title,
            String description
    ) {}

    public record TriageRequest(
            Report.Status status,
            Report.Severity severity
    ) {}
}
