package com.milestake.blockchain.contract;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read-only view of a participant record.
 *
 * @param joinOrder zero-based position in which the participant joined
 */
public record ParticipantSnapshot(
        String address,
        String correlationId,
        BigInteger stake,
        boolean joined,
        int joinOrder,
        Instant joinedAt
) {}
