package com.bugbounty.api.auth;

import com.bugbounty.core.domain.User;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbound view of a user. Carries no credential material.
 */
public record UserResponse(
        UUID id,
        String email,
        String name,
        User.Role role,
        Instant createdAt,
        Instant updatedAt
) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getRole(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
