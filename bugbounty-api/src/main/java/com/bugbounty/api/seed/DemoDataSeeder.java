package com.bugbounty.api.seed;

import com.bugbounty.core.domain.Program;
import com.bugbounty.core.domain.Report;
import com.bugbounty.core.domain.User;
import com.bugbounty.core.domain.User.Role;
import com.bugbounty.core.repository.ProgramRepository;
import com.bugbounty.core.repository.ReportRepository;
import com.bugbounty.core.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads demo accounts and a sample program at startup.
 * Enabled with {@code bugbounty.seed.enabled=true}. Running it again leaves
 * existing rows alone.
 */
@Component
@ConditionalOnProperty(prefix = "bugbounty.seed", name = "enabled", havingValue = "true")
public class DemoDataSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoDataSeeder.class);

    static final String DEMO_PASSWORD = "testtest";
    static final String SAMPLE_PROGRAM = "Sample Bug Bounty Program";

    private final UserRepository userRepository;
    private final ProgramRepository programRepository;
    private final ReportRepository reportRepository;
    private final PasswordEncoder passwordEncoder;

    public DemoDataSeeder(
            UserRepository userRepository,
            ProgramRepository programRepository,
            ReportRepository reportRepository,
            PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.programRepository = programRepository;
        this.reportRepository = reportRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        log.info("Seeding demo data");

        String passwordHash = passwordEncoder.encode(DEMO_PASSWORD);
        ensureUser("admin@example.com", "Admin User", passwordHash, Role.ADMIN);
        User company = ensureUser("company@example.com", "Company User", passwordHash, Role.COMPANY);
        User researcher = ensureUser("researcher@example.com", "Researcher User", passwordHash, Role.RESEARCHER);

        if (programRepository.existsByName(SAMPLE_PROGRAM)) {
            log.info("Sample program already present, skipping");
            return;
        }

        Program program = programRepository.save(Program.create(
                company.getId(),
                SAMPLE_PROGRAM,
                "Find and report bugs in our system.",
                "api.example.com",
                100,
                1000
        ));

        Report report = Report.submit(program.getId(), researcher.getId(),
                "Sample Bug Report", "This is a sample bug report.");
        report.triage(null, Report.Severity.HIGH);
        reportRepository.save(report);

        log.info("Demo data seeded: program {}", program.getId());
    }

    private User ensureUser(String email, String name, String passwordHash, Role role) {
        return userRepository.findByEmail(email)
                .orElseGet(() -> userRepository.save(User.register(email, name, passwordHash, role)));
    }
}
