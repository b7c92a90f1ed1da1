package com.milestake.blockchain.contract;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Facts emitted by the ledger after an operation commits.
 */
public sealed interface LedgerEvent {

    long challengeId();

    record ChallengeCreated(long challengeId, String creator, Instant startTime, Instant endTime,
                            BigInteger stakeAmount) implements LedgerEvent {}

    record ParticipantJoined(long challengeId, String participant, String correlationId) implements LedgerEvent {}

    record ChallengeFinalized(long challengeId, String winner, String resultHash) implements LedgerEvent {}

    record PrizeClaimed(long challengeId, String winner, BigInteger amount) implements LedgerEvent {}

    record ChallengeCancelled(long challengeId) implements LedgerEvent {}

    record StakeWithdrawn(long challengeId, String participant, BigInteger amount) implements LedgerEvent {}

    record EmergencyWithdrawal(long challengeId, String participant, BigInteger amount) implements LedgerEvent {}

    /**
     * Not tied to a challenge; {@code challengeId} is -1.
     */
    record AttesterKeyUpdated(long challengeId, String attester, long version) implements LedgerEvent {}
}
