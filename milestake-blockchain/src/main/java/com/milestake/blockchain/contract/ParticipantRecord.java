package com.milestake.blockchain.contract;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One identity's stake in one challenge. The record outlives the stake as an audit trail.
 */
final class ParticipantRecord {

    private final String address;
    private final String correlationId;
    private final int joinOrder;
    private final Instant joinedAt;
    private BigInteger stake;

    ParticipantRecord(String address, String correlationId, int joinOrder, Instant joinedAt, BigInteger stake) {
        this.address = address;
        this.correlationId = correlationId;
        this.joinOrder = joinOrder;
        this.joinedAt = joinedAt;
        this.stake = stake;
    }

    BigInteger zeroStake() {
        BigInteger released = stake;
        stake = BigInteger.ZERO;
        return released;
    }

    void restoreStake(BigInteger previous) {
        stake = previous;
    }

    boolean hasStake() {
        return stake.signum() > 0;
    }

    String getAddress() { return address; }
    String getCorrelationId() { return correlationId; }
    int getJoinOrder() { return joinOrder; }
    Instant getJoinedAt() { return joinedAt; }
    BigInteger getStake() { return stake; }

    ParticipantSnapshot snapshot() {
        return new ParticipantSnapshot(address, correlationId, stake, true, joinOrder, joinedAt);
    }
}
