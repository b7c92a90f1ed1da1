package com.milestake.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Mileage reported by the activity service for one participant over one window.
 * Rows are append-only; the most recently recorded one is authoritative.
 */
@Entity
@Table(name = "mileage_snapshots", indexes = {
    @Index(name = "idx_mileage_challenge_address", columnList = "ledger_id, challenge_id, address, recorded_at")
})
public class MileageSnapshot {

    // insertion order; breaks ties between snapshots recorded at the same instant
    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "mileage_snapshot_seq")
    @SequenceGenerator(name = "mileage_snapshot_seq", sequenceName = "mileage_snapshot_seq")
    private Long id;

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
    @PositiveOrZero
    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal miles;

    @PositiveOrZero
    @Column(name = "sample_count", nullable = false, updatable = false)
    private int sampleCount;

    @NotNull
    @Column(name = "window_start", nullable = false, updatable = false)
    private Instant windowStart;

    @NotNull
    @Column(name = "window_end", nullable = false, updatable = false)
    private Instant windowEnd;

    @NotNull
    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    protected MileageSnapshot() {}

    public static MileageSnapshot record(String ledgerId, long challengeId, String address,
                                         BigDecimal miles, int sampleCount, Instant windowStart,
                                         Instant windowEnd, Instant recordedAt) {
        if (miles == null || miles.signum() < 0) {
            throw new IllegalArgumentException("Miles must be zero or positive");
        }
        var snapshot = new MileageSnapshot();
        snapshot.ledgerId = ledgerId;
        snapshot.challengeId = challengeId;
        snapshot.address = address;
        snapshot.miles = miles;
        snapshot.sampleCount = sampleCount;
        snapshot.windowStart = windowStart;
        snapshot.windowEnd = windowEnd;
        snapshot.recordedAt = recordedAt;
        return snapshot;
    }

    public Long getId() { return id; }
    public String getLedgerId() { return ledgerId; }
    public Long getChallengeId() { return challengeId; }
    public String getAddress() { return address; }
    public BigDecimal getMiles() { return miles; }
    public int getSampleCount() { return sampleCount; }
    public Instant getWindowStart() { return windowStart; }
    public Instant getWindowEnd() { return windowEnd; }
    public Instant getRecordedAt() { return recordedAt; }
}
