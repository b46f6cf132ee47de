package com.bugbounty.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * User - an actor of the bug bounty platform.
 *
 * Every user holds exactly one role:
 * - RESEARCHER: submits vulnerability reports against programs
 * - COMPANY: owns programs and triages the reports filed against them
 * - ADMIN: platform operator
 *
 * The email is the login key and is globally unique. Identity and role are
 * fixed after registration.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_email", columnList = "email", unique = true),
    @Index(name = "idx_user_role", columnList = "role")
})
public class User {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "email", nullable = false, length = ColumnLengths.TEXT)
    private String email;

    @NotNull
    @Column(name = "name", nullable = false, length = ColumnLengths.TEXT)
    private String name;

    @NotNull
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, updatable = false)
    private Role role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum Role {
        RESEARCHER,
        COMPANY,
        ADMIN
    }

    protected User() {}

    /**
     * Registers a new user. The password must already be hashed.
     * A null role falls back to RESEARCHER.
     */
    public static User register(String email, String name, String passwordHash, Role role) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash is required");
        }
        User user = new User();
        user.id = UUID.randomUUID();
        user.email = email;
        user.name = name;
        user.passwordHash = passwordHash;
        user.role = role != null ? role : Role.RESEARCHER;
        user.createdAt = Instant.now();
        user.updatedAt = user.createdAt;
        return user;
    }

    public boolean hasRole(Role candidate) {
        return this.role == candidate;
    }

    // Getters
    public UUID getId() { return id; }
    public String getEmail() { return email; }
    public String getName() { return name; }
    public String getPasswordHash() { return passwordHash; }
    public Role getRole() { return role; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
