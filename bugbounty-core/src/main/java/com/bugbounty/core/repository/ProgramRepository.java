package com.bugbounty.core.repository;

import com.bugbounty.core.domain.Program;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for Program entities.
 */
@Repository
public interface ProgramRepository extends JpaRepository<Program, UUID> {

    boolean existsByName(String name);
}
