package com.milestake.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

/**
 * A participant's signed acknowledgement of their final mileage.
 */
@Entity
@Table(name = "mileage_confirmations",
    uniqueConstraints = @UniqueConstraint(name = "uk_confirmation_challenge_address",
        columnNames = {"ledger_id", "challenge_id", "address"}))
public class MileageConfirmation {

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
    private String address;

    @NotNull
    @Column(nullable = false, length = 132, updatable = false)
    private String signature;

    @NotNull
    @Column(name = "confirmed_at", nullable = false, updatable = false)
    private Instant confirmedAt;

    protected MileageConfirmation() {}

    public static MileageConfirmation create(String ledgerId, long challengeId, String address,
                                             String signature, Instant confirmedAt) {
        var confirmation = new MileageConfirmation();
        confirmation.ledgerId = ledgerId;
        confirmation.challengeId = challengeId;
        confirmation.address = address;
        confirmation.signature = signature;
        confirmation.confirmedAt = confirmedAt;
        return confirmation;
    }

    public UUID getId() { return id; }
    public String getLedgerId() { return ledgerId; }
    public Long getChallengeId() { return challengeId; }
    public String getAddress() { return address; }
    public String getSignature() { return signature; }
    public Instant getConfirmedAt() { return confirmedAt; }
}
