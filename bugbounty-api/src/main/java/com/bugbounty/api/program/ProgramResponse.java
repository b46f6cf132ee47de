package com.bugbounty.api.program;

import com.bugbounty.core.domain.Program;

import java.time.Instant;
import java.util.UUID;

public record ProgramResponse(
        UUID id,
        String name,
        String description,
        String scope,
        Integer rewardMin,
        Integer rewardMax,
        UUID companyId,
        Instant createdAt,
        Instant updatedAt
) {

    public static ProgramResponse from(Program program) {
        return new ProgramResponse(
                program.getId(),
                program.getName(),
                program.getDescription(),
                program.getScope(),
                program.getRewardMin(),
                program.getRewardMax(),
                program.getCompanyId(),
                program.getCreatedAt(),
                program.getUpdatedAt()
        );
    }
}
