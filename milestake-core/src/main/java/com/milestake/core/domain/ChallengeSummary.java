package com.milestake.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Display copy of one ledger challenge. Derived from ledger events and always
 * rebuildable from the ledger itself.
 */
@Entity
@Table(name = "challenge_summaries",
    uniqueConstraints = @UniqueConstraint(name = "uk_challenge_summary_ledger_challenge",
        columnNames = {"ledger_id", "challenge_id"}),
    indexes = {
    @Index(name = "idx_challenge_summary_state", columnList = "state"),
    @Index(name = "idx_challenge_summary_creator", columnList = "creator")
})
public class ChallengeSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Size(max = 64)
    @Column(name = "ledger_id", nullable = false, length = 64, updatable = false)
    private String ledgerId;

    @NotNull
    @Column(name = "challenge_id", nullable = false, updatable = false)
    private Long challengeId;

    @NotNull
    @Size(min = 42, max = 42)
    @Column(nullable = false, length = 42)
    private String creator;

    @NotNull
    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @NotNull
    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @NotNull
    @Column(name = "stake_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger stakeAmount;

    @NotNull
    @Column(name = "total_staked", nullable = false, precision = 78, scale = 0)
    private BigInteger totalStaked;

    @NotNull
    @Column(nullable = false, length = 20)
    private String state;

    @Column(length = 42)
    private String winner;

    @Column(name = "result_hash", length = 66)
    private String resultHash;

    @PositiveOrZero
    @Column(name = "participant_count", nullable = false)
    private int participantCount;

    @PositiveOrZero
    @Column(name = "whitelist_size", nullable = false)
    private int whitelistSize;

    @NotNull
    @Column(name = "projected_at", nullable = false)
    private Instant projectedAt;

    @Version
    private Long version;

    protected ChallengeSummary() {}

    public static ChallengeSummary create(String ledgerId, long challengeId, String creator,
                                          Instant startTime, Instant endTime, BigInteger stakeAmount,
                                          int whitelistSize, Instant projectedAt) {
        var summary = new ChallengeSummary();
        summary.ledgerId = ledgerId;
        summary.challengeId = challengeId;
        summary.creator = creator;
        summary.startTime = startTime;
        summary.endTime = endTime;
        summary.stakeAmount = stakeAmount;
        summary.totalStaked = BigInteger.ZERO;
        summary.state = "PENDING";
        summary.whitelistSize = whitelistSize;
        summary.projectedAt = projectedAt;
        return summary;
    }

    /**
     * Overwrites the mutable ledger fields with a fresh projection.
     */
    public void project(String state, BigInteger totalStaked, int participantCount,
                        String winner, String resultHash, Instant projectedAt) {
        this.state = state;
        this.totalStaked = totalStaked;
        this.participantCount = participantCount;
        this.winner = winner;
        this.resultHash = resultHash;
        this.projectedAt = projectedAt;
    }

    public UUID getId() { return id; }
    public String getLedgerId() { return ledgerId; }
    public Long getChallengeId() { return challengeId; }
    public String getCreator() { return creator; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public BigInteger getStakeAmount() { return stakeAmount; }
    public BigInteger getTotalStaked() { return totalStaked; }
    public String getState() { return state; }
    public String getWinner() { return winner; }
    public String getResultHash() { return resultHash; }
    public int getParticipantCount() { return participantCount; }
    public int getWhitelistSize() { return whitelistSize; }
    public Instant getProjectedAt() { return projectedAt; }
}
