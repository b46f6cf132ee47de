package com.bugbounty.api.security;

import com.bugbounty.api.error.ForbiddenException;
import com.bugbounty.core.domain.Program;
import com.bugbounty.core.domain.Report;
import com.bugbounty.core.domain.User;
import com.bugbounty.core.domain.User.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ownership gate. Decides whether a user may act on one specific program or
 * report instance.
 *
 * A program is owned by its company. A report is owned by the company that
 * owns its parent program, so both resource kinds go through
 * {@link #actorOwns(User, Program)}. Callers must load the resource (and
 * answer 404 when it is missing) before consulting this policy.
 */
@Component
public class AccessPolicy {

    private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

    /**
     * Which reports of a program a user may list.
     */
    public enum ReportVisibility {
        /** Every report of the program. */
        ALL,
        /** Only the user's own submissions. */
        OWN_SUBMISSIONS
    }

    public boolean actorOwns(User actor, Program program) {
        return program.isOwnedBy(actor.getId());
    }

    /**
     * A report is visible to the researcher who submitted it and to the
     * company owning its program.
     */
    public boolean canView(User actor, Report report, Program program) {
        boolean submittingResearcher = actor.hasRole(Role.RESEARCHER) && report.isSubmittedBy(actor.getId());
        boolean owningCompany = actor.hasRole(Role.COMPANY) && actorOwns(actor, program);
        return submittingResearcher || owningCompany;
    }

    /**
     * Throws {@link ForbiddenException} with the given message unless the
     * actor owns the program.
     */
    public void requireOwner(User actor, Program program, String deniedMessage) {
        if (!actorOwns(actor, program)) {
            deny(actor, deniedMessage);
        }
    }

    public void requireViewer(User actor, Report report, Program program) {
        if (!canView(actor, report, program)) {
            deny(actor, "You are not authorized to view this report");
        }
    }

    /**
     * Companies see every report of programs they own and are refused on
     * anyone else's. Every other role is narrowed to its own submissions.
     */
    public ReportVisibility reportVisibility(User actor, Program program) {
        if (actor.hasRole(Role.COMPANY)) {
            requireOwner(actor, program, "You are not authorized to view reports for this program");
            return ReportVisibility.ALL;
        }
        return ReportVisibility.OWN_SUBMISSIONS;
    }

    private void deny(User actor, String message) {
        log.warn("Ownership check failed for user {}: {}", actor.getId(), message);
        throw new ForbiddenException(message);
    }
}
