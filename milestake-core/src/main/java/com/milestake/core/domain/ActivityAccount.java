package com.milestake.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * OAuth credentials linking a wallet to its activity-service account.
 */
@Entity
@Table(name = "activity_accounts",
    uniqueConstraints = @UniqueConstraint(name = "uk_activity_wallet_provider",
        columnNames = {"wallet_address", "provider"}))
public class ActivityAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "wallet_address", nullable = false, length = 42)
    private String walletAddress;

    @NotBlank
    @Column(nullable = false, length = 32)
    private String provider;

    @NotBlank
    @Column(name = "athlete_id", nullable = false)
    private String athleteId;

    @NotBlank
    @Column(name = "access_token", nullable = false, length = 512)
    private String accessToken;

    @NotBlank
    @Column(name = "refresh_token", nullable = false, length = 512)
    private String refreshToken;

    @NotNull
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected ActivityAccount() {}

    public static ActivityAccount link(String walletAddress, String provider, String athleteId,
                                       String accessToken, String refreshToken, Instant expiresAt, Instant now) {
        var account = new ActivityAccount();
        account.walletAddress = walletAddress;
        account.provider = provider;
        account.athleteId = athleteId;
        account.accessToken = accessToken;
        account.refreshToken = refreshToken;
        account.expiresAt = expiresAt;
        account.updatedAt = now;
        return account;
    }

    public void rotateTokens(String accessToken, String refreshToken, Instant expiresAt, Instant now) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
        this.updatedAt = now;
    }

    public void relink(String athleteId) {
        this.athleteId = athleteId;
    }

    public UUID getId() { return id; }
    public String getWalletAddress() { return walletAddress; }
    public String getProvider() { return provider; }
    public String getAthleteId() { return athleteId; }
    public String getAccessToken() { return accessToken; }
    public String getRefreshToken() { return refreshToken; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
