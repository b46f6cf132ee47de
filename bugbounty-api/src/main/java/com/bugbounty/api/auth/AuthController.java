package com.bugbounty.api.auth;

import com.bugbounty.core.domain.User;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Authentication REST API endpoints.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthenticationService authenticationService;

    public AuthController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    /**
     * Register a new user.
     * POST /api/auth/register
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@RequestBody RegisterRequest request) {
        AuthenticationService.AuthResult result = authenticationService.register(
                request.name(),
                request.email(),
                request.password(),
                request.role()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(result));
    }

    /**
     * Exchange credentials for a token.
     * POST /api/auth/login
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@RequestBody LoginRequest request) {
        AuthenticationService.AuthResult result = authenticationService.login(
                request.email(),
                request.password()
        );
        return ResponseEntity.ok(toResponse(result));
    }

    /**
     * The authenticated caller.
     * GET /api/auth/me
     */
    @GetMapping("/me")
    public ResponseEntity<MeResponse> me(@AuthenticationPrincipal User actor) {
        return ResponseEntity.ok(new MeResponse(UserResponse.from(actor)));
    }

    private AuthResponse toResponse(AuthenticationService.AuthResult result) {
        return new AuthResponse(
                result.token(),
                result.expiresAt().getEpochSecond(),
                UserResponse.from(result.user())
        );
    }

    public record RegisterRequest(
            String name,
            String email,
            String password,
            User.Role role
    ) {}

    public record LoginRequest(
            String email,
            String password
    ) {}

    public record AuthResponse(
            String token,
            long expiresAt,
            UserResponse user
    ) {}

    public record MeResponse(
            UserResponse user
    ) {}
}
