package com.bugbounty.core.repository;

import com.bugbounty.core.domain.Report;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for Report entities.
 */
@Repository
public interface ReportRepository extends JpaRepository<Report, UUID> {

    /**
     * All reports filed against a program.
     */
    List<Report> findByProgramIdOrderByCreatedAtAsc(UUID programId);

    /**
     * Reports filed against a program by one researcher.
     */
    List<Report> findByProgramIdAndResearcherIdOrderByCreatedAtAsc(UUID programId, UUID researcherId);

    /**
     * Removes every report of a program. Used when the program is deleted.
     */
    @Modifying
    @Query("DELETE FROM Report r WHERE r.programId = :programId")
    int deleteByProgramId(@Param("programId") UUID programId);
}
