package com.milestake.blockchain.contract;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a challenge as of one instant.
 *
 * @param storedState    last state written to storage
 * @param effectiveState state derived for the snapshot instant
 * @param winner         null until settled
 * @param resultHash     null until attested
 */
public record ChallengeSnapshot(
        long id,
        String creator,
        Instant startTime,
        Instant endTime,
        BigInteger stakeAmount,
        BigInteger totalStaked,
        ChallengeState storedState,
        ChallengeState effectiveState,
        String winner,
        String resultHash,
        int participantCount,
        List<String> whitelist
) {}
