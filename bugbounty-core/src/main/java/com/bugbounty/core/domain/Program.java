package com.bugbounty.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Program - a company's bug bounty scope definition.
 *
 * Owned by exactly one COMPANY user. The owner is taken from the
 * authenticated creator and can never be reassigned. The reward range is
 * stored as given; rewardMin is not required to be below rewardMax.
 */
@Entity
@Table(name = "programs", indexes = {
    @Index(name = "idx_program_company", columnList = "company_id")
})
public class Program {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "name", nullable = false, length = ColumnLengths.TEXT)
    private String name;

    @NotNull
    @Column(name = "description", nullable = false, length = ColumnLengths.TEXT)
    private String description;

    @NotNull
    @Column(name = "scope", nullable = false, length = ColumnLengths.TEXT)
    private String scope;

    @NotNull
    @Column(name = "reward_min", nullable = false)
    private Integer rewardMin;

    @NotNull
    @Column(name = "reward_max", nullable = false)
    private Integer rewardMax;

    @NotNull
    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Program() {}

    public static Program create(
            UUID companyId,
            String name,
            String description,
            String scope,
            int rewardMin,
            int rewardMax) {
        if (companyId == null) {
            throw new IllegalArgumentException("Company ID is required");
        }
        Program program = new Program();
        program.id = UUID.randomUUID();
        program.companyId = companyId;
        program.name = name;
        program.description = description;
        program.scope = scope;
        program.rewardMin = rewardMin;
        program.rewardMax = rewardMax;
        program.createdAt = Instant.now();
        program.updatedAt = program.createdAt;
        return program;
    }

    /**
     * Applies a partial update. Null arguments leave the field unchanged.
     */
    public void update(String name, String description, String scope, Integer rewardMin, Integer rewardMax) {
        if (name != null) {
            this.name = name;
        }
        if (description != null) {
            this.description = description;
        }
        if (scope != null) {
            this.scope = scope;
        }
        if (rewardMin != null) {
            this.rewardMin = rewardMin;
        }
        if (rewardMax != null) {
            this.rewardMax = rewardMax;
        }
        this.updatedAt = Instant.now();
    }

    public boolean isOwnedBy(UUID userId) {
        return companyId.equals(userId);
    }

    // Getters
    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getScope() { return scope; }
    public Integer getRewardMin() { return rewardMin; }
    public Integer getRewardMax() { return rewardMax; }
    public UUID getCompanyId() { return companyId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
