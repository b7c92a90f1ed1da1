package com.milestake.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Display copy of one participant's ledger record.
 */
@Entity
@Table(name = "participant_summaries",
    uniqueConstraints = @UniqueConstraint(name = "uk_participant_challenge_address",
        columnNames = {"ledger_id", "challenge_id", "address"}),
    indexes = @Index(name = "idx_participant_address", columnList = "address"))
public class ParticipantSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Size(max = 64)
    @Column(name = "ledger_id", nullable = false, length = 64, updatable = false)
    private String ledgerId;

    @NotNull
    @Column(name = "challenge_id", nullable = false)
    private Long challengeId;

    @NotNull
    @Column(nullable = false, length = 42)
    private String address;

    @NotBlank
    @Column(name = "correlation_id", nullable = false)
    private String correlationId;

    @Column(name = "join_order", nullable = false)
    private int joinOrder;

    @NotNull
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger stake;

    @NotNull
    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;

    @Version
    private Long version;

    protected ParticipantSummary() {}

    public static ParticipantSummary create(String ledgerId, long challengeId, String address,
                                            String correlationId, int joinOrder, BigInteger stake, Instant joinedAt) {
        var participant = new ParticipantSummary();
        participant.ledgerId = ledgerId;
        participant.challengeId = challengeId;
        participant.address = address;
        participant.correlationId = correlationId;
        participant.joinOrder = joinOrder;
        participant.stake = stake;
        participant.joinedAt = joinedAt;
        return participant;
    }

    public void updateStake(BigInteger stake) {
        this.stake = stake;
    }

    public UUID getId() { return id; }
    public String getLedgerId() { return ledgerId; }
    public Long getChallengeId() { return challengeId; }
    public String getAddress() { return address; }
    public String getCorrelationId() { return correlationId; }
    public int getJoinOrder() { return joinOrder; }
    public BigInteger getStake() { return stake; }
    public Instant getJoinedAt() { return joinedAt; }
}
