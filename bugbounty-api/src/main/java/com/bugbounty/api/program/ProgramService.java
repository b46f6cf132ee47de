package com.bugbounty.api.program;

import com.bugbounty.api.error.ResourceIds;
import com.bugbounty.api.error.ResourceNotFoundException;
import com.bugbounty.api.error.ValidationException;
import com.bugbounty.api.security.AccessPolicy;
import com.bugbounty.core.domain.Program;
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
 * Service for bounty program management.
 *
 * Listing and reading are public. Mutations require the acting company to
 * own the program; the role check itself happens in the security filter
 * chain before any of these methods run.
 */
@Service
public class ProgramService {

    private static final Logger log = LoggerFactory.getLogger(ProgramService.class);

    static final String NOT_FOUND = "Program not found";
    static final String ALL_FIELDS_REQUIRED = "All fields are required";

    private final ProgramRepository programRepository;
    private final ReportRepository reportRepository;
    private final AccessPolicy accessPolicy;

    public ProgramService(
            ProgramRepository programRepository,
            ReportRepository reportRepository,
            AccessPolicy accessPolicy) {
        this.programRepository = programRepository;
        this.reportRepository = reportRepository;
        this.accessPolicy = accessPolicy;
    }

    @Transactional(readOnly = true)
    public List<Program> list() {
        return programRepository.findAll();
    }

    @Transactional(readOnly = true)
    public Program get(String programId) {
        return load(programId);
    }

    /**
     * Creates a program owned by the acting company.
     * Rewards of zero count as missing.
     */
    @Transactional
    public Program create(User actor, ProgramDraft draft) {
        if (isBlank(draft.name()) || isBlank(draft.description()) || isBlank(draft.scope())
                || isMissing(draft.rewardMin()) || isMissing(draft.rewardMax())) {
            throw new ValidationException(ALL_FIELDS_REQUIRED);
        }

        Program program = programRepository.save(Program.create(
                actor.getId(),
                draft.name(),
                draft.description(),
                draft.scope(),
                draft.rewardMin(),
                draft.rewardMax()
        ));

        log.info("Company {} created program {}", actor.getId(), program.getId());
        return program;
    }

    /**
     * Applies the non-null fields of the draft to an owned program.
     */
    @Transactional
    public Program update(User actor, String programId, ProgramDraft draft) {
        Program program = load(programId);
        accessPolicy.requireOwner(actor, program, "You are not authorized to update this program");

        program.update(draft.name(), draft.description(), draft.scope(), draft.rewardMin(), draft.rewardMax());
        return programRepository.save(program);
    }

    /**
     * Deletes an owned program together with every report filed against it.
     */
    @Transactional
    public void delete(User actor, String programId) {
        Program program = load(programId);
        accessPolicy.requireOwner(actor, program, "You are not authorized to delete this program");

        int removedReports = reportRepository.deleteByProgramId(program.getId());
        programRepository.delete(program);
        log.info("Company {} deleted program {} ({} reports removed)", actor.getId(), program.getId(), removedReports);
    }

    private Program load(String programId) {
        UUID id = ResourceIds.parse(programId, NOT_FOUND);
        return programRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isMissing(Integer value) {
        return value == null || value == 0;
    }

    /**
     * Program fields as supplied by a client. Any of them may be null.
     */
    public record ProgramDraft(
            String name,
            String description,
            String scope,
            Integer rewardMin,
            Integer rewardMax
    ) {}
}
