package com.milestake.blockchain.contract;

/**
 * Lifecycle of a challenge.
 * PENDING and ACTIVE are projections of time and head count; the remaining
 * states are facts that do not revert once reached.
 */
public enum ChallengeState {
    PENDING,
    ACTIVE,
    GRACE_PERIOD,
    FINALIZED,
    CANCELLED,
    COMPLETED;

    /**
     * States that are authoritative once stored.
     */
    public boolean isTerminal() {
        return this == FINALIZED || this == CANCELLED || this == COMPLETED;
    }
}
