package com.bugbounty.api.auth;

import com.bugbounty.api.error.EmailAlreadyExistsException;
import com.bugbounty.api.error.ForbiddenException;
import com.bugbounty.api.error.UnauthenticatedException;
import com.bugbounty.api.error.ValidationException;
import com.bugbounty.core.domain.User;
import com.bugbounty.core.domain.User.Role;
import com.bugbounty.core.repository.UserRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Locale;

/**
 * Authentication service handling registration and login.
 */
@Service
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    static final String ALL_FIELDS_REQUIRED = "All fields are required";
    static final String EMAIL_TAKEN = "A user with this email already exists";
    static final String BAD_CREDENTIALS = "Invalid email or password";
    static final String EMAIL_CONSTRAINT = "idx_user_email";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final RegistrationProperties registrationProperties;

    public AuthenticationService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            RegistrationProperties registrationProperties) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.registrationProperties = registrationProperties;
    }

    /**
     * Creates a user and issues its first token.
     * The role defaults to RESEARCHER when not given.
     */
    @Transactional
    public AuthResult register(String name, String email, String password, Role requestedRole) {
        if (isBlank(name) || isBlank(email) || isBlank(password)) {
            throw new ValidationException(ALL_FIELDS_REQUIRED);
        }
        if (userRepository.existsByEmail(email)) {
            throw new EmailAlreadyExistsException(EMAIL_TAKEN);
        }

        Role role = requestedRole != null ? requestedRole : Role.RESEARCHER;
        if (!registrationProperties.isSelfAssignable(role)) {
            log.warn("Refused self-registration of {} with role {}", email, role);
            throw new ForbiddenException("Role " + role + " cannot be self-assigned");
        }

        User user = User.register(email, name, passwordEncoder.encode(password), role);
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            if (violatesUniqueEmail(e)) {
                // lost a race with a concurrent registration of the same email
                throw new EmailAlreadyExistsException(EMAIL_TAKEN);
            }
            throw e;
        }

        log.info("Registered user {} with role {}", user.getId(), user.getRole());
        return toResult(user);
    }

    /**
     * Verifies credentials and issues a token.
     * Unknown email and wrong password fail identically.
     */
    @Transactional(readOnly = true)
    public AuthResult login(String email, String password) {
        if (isBlank(email) || isBlank(password)) {
            throw new ValidationException(ALL_FIELDS_REQUIRED);
        }

        User user = userRepository.findByEmail(email)
                .filter(candidate -> passwordEncoder.matches(password, candidate.getPasswordHash()))
                .orElseThrow(() -> new UnauthenticatedException(BAD_CREDENTIALS));

        log.info("User {} logged in", user.getId());
        return toResult(user);
    }

    private AuthResult toResult(User user) {
        JwtTokenService.IssuedToken token = jwtTokenService.issue(user);
        return new AuthResult(token.token(), token.expiresAt(), user);
    }

    static boolean violatesUniqueEmail(DataIntegrityViolationException e) {
        if (!(e.getCause() instanceof ConstraintViolationException)) {
            return false;
        }
        String constraint = ((ConstraintViolationException) e.getCause()).getConstraintName();
        return constraint != null && constraint.toLowerCase(Locale.ROOT).contains(EMAIL_CONSTRAINT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record AuthResult(
            String token,
            Instant expiresAt,
            User user
    ) {}
}
