package com.bugbounty.core.repository;

import com.bugbounty.core.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for User entities.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Finds a user by login email.
     */
    Optional<User> findByEmail(String email);

    /**
     * Checks if an email is already registered.
     */
    boolean existsByEmail(String email);
}
