package com.bugbounty.api.program;

import com.bugbounty.core.domain.User;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for bounty programs.
 *
 * Endpoints:
 * - GET /api/programs - List all programs
 * - GET /api/programs/{id} - Get one program
 * - POST /api/programs - Create a program (COMPANY)
 * - PUT /api/programs/{id} - Update an owned program (COMPANY)
 * - DELETE /api/programs/{id} - Delete an owned program (COMPANY)
 */
@RestController
@RequestMapping("/api/programs")
public class ProgramController {

    private final ProgramService programService;

    public ProgramController(ProgramService programService) {
        this.programService = programService;
    }

    @GetMapping
    public ResponseEntity<List<ProgramResponse>> list() {
        return ResponseEntity.ok(programService.list().stream()
                .map(ProgramResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProgramResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(ProgramResponse.from(programService.get(id)));
    }

    @PostMapping
    public ResponseEntity<ProgramResponse> create(
            @AuthenticationPrincipal User actor,
            @RequestBody ProgramService.ProgramDraft request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ProgramResponse.from(programService.create(actor, request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ProgramResponse> update(
            @AuthenticationPrincipal User actor,
            @PathVariable String id,
            @RequestBody ProgramService.ProgramDraft request) {
        return ResponseEntity.ok(ProgramResponse.from(programService.update(actor, id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal User actor,
            @PathVariable String id) {
        programService.delete(actor, id);
        return ResponseEntity.noContent().build();
    }
}
