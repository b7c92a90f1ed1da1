package com.milestake.blockchain.contract;

import java.time.Instant;

/**
 * Derives the effective lifecycle state from stored fields and the current time.
 * Pure: equal inputs always give the same state, and nothing is written.
 */
public final class EffectiveStates {

    private EffectiveStates() {}

    public static ChallengeState resolve(
            ChallengeState storedState,
            Instant startTime,
            Instant endTime,
            int participantCount,
            int whitelistSize,
            Instant now) {

        if (storedState.isTerminal()) {
            return storedState;
        }
        if (storedState == ChallengeState.PENDING
                && !now.isBefore(startTime)
                && participantCount < whitelistSize) {
            return ChallengeState.CANCELLED;
        }
        if (!now.isBefore(endTime)) {
            return ChallengeState.GRACE_PERIOD;
        }
        if (!now.isBefore(startTime)) {
            return ChallengeState.ACTIVE;
        }
        return ChallengeState.PENDING;
    }

    static ChallengeState resolve(ChallengeRecord challenge, Instant now) {
        return resolve(
                challenge.getStoredState(),
                challenge.getStartTime(),
                challenge.getEndTime(),
                challenge.getParticipantCount(),
                challenge.getWhitelist().size(),
                now);
    }
}
