package com.milestake.blockchain.contract;

import java.time.Duration;

/**
 * Time windows enforced by the ledger.
 *
 * @param emergencyPeriod   delay after end time before unilateral withdrawal opens
 *                          and attested claims close
 * @param attestationMaxAge oldest attestation the ledger accepts
 */
public record SettlementPolicy(Duration emergencyPeriod, Duration attestationMaxAge) {

    public static final Duration DEFAULT_EMERGENCY_PERIOD = Duration.ofDays(14);
    public static final Duration DEFAULT_ATTESTATION_MAX_AGE = Duration.ofDays(30);

    public SettlementPolicy {
        if (emergencyPeriod == null || emergencyPeriod.isNegative() || emergencyPeriod.isZero()) {
            throw new IllegalArgumentException("Emergency period must be positive");
        }
        if (attestationMaxAge == null || attestationMaxAge.isNegative() || attestationMaxAge.isZero()) {
            throw new IllegalArgumentException("Attestation max age must be positive");
        }
    }

    public static SettlementPolicy defaults() {
        return new SettlementPolicy(DEFAULT_EMERGENCY_PERIOD, DEFAULT_ATTESTATION_MAX_AGE);
    }
}
