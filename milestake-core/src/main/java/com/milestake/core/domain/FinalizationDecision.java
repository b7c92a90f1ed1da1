package com.milestake.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The first accepted finalization decision for a challenge. Later attestations
 * re-sign the winner and result recorded here.
 */
@Entity
@Table(name = "finalization_decisions",
    uniqueConstraints = @UniqueConstraint(name = "uk_decision_ledger_challenge",
        columnNames = {"ledger_id", "challenge_id"}))
public class FinalizationDecision {

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
    @Column(nullable = false, length = 42, updatable = false)
    private String winner;

    @NotNull
    @Column(name = "winner_miles", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal winnerMiles;

    @NotNull
    @Column(name = "result_hash", nullable = false, length = 66, updatable = false)
    private String resultHash;

    @NotNull
    @Column(name = "result_json", nullable = false, length = 65535, updatable = false)
    private String resultJson;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "decision_trigger", nullable = false, length = 24, updatable = false)
    private Trigger trigger;

    @NotNull
    @Column(name = "decided_at", nullable = false, updatable = false)
    private Instant decidedAt;

    protected FinalizationDecision() {}

    public static FinalizationDecision create(String ledgerId, long challengeId, String winner,
                                              BigDecimal winnerMiles, String resultHash, String resultJson,
                                              Trigger trigger, Instant decidedAt) {
        var decision = new FinalizationDecision();
        decision.ledgerId = ledgerId;
        decision.challengeId = challengeId;
        decision.winner = winner;
        decision.winnerMiles = winnerMiles;
        decision.resultHash = resultHash;
        decision.resultJson = resultJson;
        decision.trigger = trigger;
        decision.decidedAt = decidedAt;
        return decision;
    }

    public UUID getId() { return id; }
    public String getLedgerId() { return ledgerId; }
    public Long getChallengeId() { return challengeId; }
    public String getWinner() { return winner; }
    public BigDecimal getWinnerMiles() { return winnerMiles; }
    public String getResultHash() { return resultHash; }
    public String getResultJson() { return resultJson; }
    public Trigger getTrigger() { return trigger; }
    public Instant getDecidedAt() { return decidedAt; }

    public enum Trigger {
        ALL_CONFIRMED, GRACE_PERIOD_EXPIRED
    }
}
