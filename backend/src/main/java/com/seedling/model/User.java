package com.seedling.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "users")
public class User {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "username", nullable = false, length = 64)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private UserRole role = UserRole.FOUNDER;

    @Column(name = "payout_account_id", length = 128)
    private String payoutAccountId;

    @Column(name = "payout_onboarding_complete", nullable = false)
    private boolean payoutOnboardingComplete = false;

    @Column(name = "payouts_enabled", nullable = false)
    private boolean payoutsEnabled = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean canJudge() {
        return role == UserRole.JUDGE || role == UserRole.ADMIN;
    }

    public boolean isPayoutReady() {
        return payoutAccountId != null && payoutOnboardingComplete && payoutsEnabled;
    }
}
