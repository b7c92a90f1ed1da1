package com.milestake.blockchain.contract;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable challenge state owned by {@link SettlementLedger}. Parameters are fixed at
 * creation; only the ledger's operations mutate the rest, under the challenge's lock.
 */
final class ChallengeRecord {

    private final long id;
    private final String creator;
    private final Instant startTime;
    private final Instant endTime;
    private final BigInteger stakeAmount;
    private final Set<String> whitelist;
    private final Map<String, ParticipantRecord> participants = new LinkedHashMap<>();

    private BigInteger totalStaked = BigInteger.ZERO;
    private ChallengeState storedState = ChallengeState.PENDING;
    private String winner;
    private String resultHash;

    ChallengeRecord(long id, String creator, Instant startTime, Instant endTime,
                    BigInteger stakeAmount, Set<String> whitelist) {
        this.id = id;
        this.creator = creator;
        this.startTime = startTime;
        this.endTime = endTime;
        this.stakeAmount = stakeAmount;
        this.whitelist = Collections.unmodifiableSet(new LinkedHashSet<>(whitelist));
    }

    void addParticipant(String address, String correlationId, BigInteger stake, Instant joinedAt) {
        ParticipantRecord participant = new ParticipantRecord(
                address, correlationId, participants.size(), joinedAt, stake);
        participants.put(address, participant);
        totalStaked = totalStaked.add(stake);
    }

    BigInteger releaseStake(ParticipantRecord participant) {
        BigInteger released = participant.zeroStake();
        totalStaked = totalStaked.subtract(released);
        return released;
    }

    /**
     * Zeroes every stake and returns the whole pool.
     */
    BigInteger releasePool() {
        BigInteger pool = totalStaked;
        participants.values().forEach(ParticipantRecord::zeroStake);
        totalStaked = BigInteger.ZERO;
        return pool;
    }

    void settle(ChallengeState state, String winner, String resultHash) {
        this.storedState = state;
        this.winner = winner;
        this.resultHash = resultHash;
    }

    void markStored(ChallengeState state) {
        this.storedState = state;
    }

    Optional<ParticipantRecord> participant(String address) {
        return Optional.ofNullable(participants.get(address));
    }

    boolean isWhitelisted(String address) {
        return whitelist.contains(address);
    }

    long getId() { return id; }
    String getCreator() { return creator; }
    Instant getStartTime() { return startTime; }
    Instant getEndTime() { return endTime; }
    BigInteger getStakeAmount() { return stakeAmount; }
    BigInteger getTotalStaked() { return totalStaked; }
    ChallengeState getStoredState() { return storedState; }
    String getWinner() { return winner; }
    String getResultHash() { return resultHash; }
    int getParticipantCount() { return participants.size(); }
    Set<String> getWhitelist() { return whitelist; }

    List<ParticipantRecord> participantsInJoinOrder() {
        return new ArrayList<>(participants.values());
    }

    Checkpoint checkpoint() {
        Map<String, BigInteger> stakes = new LinkedHashMap<>();
        participants.forEach((address, participant) -> stakes.put(address, participant.getStake()));
        return new Checkpoint(totalStaked, storedState, winner, resultHash, stakes);
    }

    void restore(Checkpoint checkpoint) {
        participants.keySet().retainAll(checkpoint.stakes().keySet());
        participants.forEach((address, participant) ->
                participant.restoreStake(checkpoint.stakes().get(address)));
        totalStaked = checkpoint.totalStaked();
        storedState = checkpoint.storedState();
        winner = checkpoint.winner();
        resultHash = checkpoint.resultHash();
    }

    ChallengeSnapshot snapshot(Instant now) {
        return new ChallengeSnapshot(
                id,
                creator,
                startTime,
                endTime,
                stakeAmount,
                totalStaked,
                storedState,
                EffectiveStates.resolve(this, now),
                winner,
                resultHash,
                participants.size(),
                List.copyOf(whitelist));
    }

    /**
     * Mutable fields captured before an operation so a failed operation leaves no trace.
     */
    record Checkpoint(
            BigInteger totalStaked,
            ChallengeState storedState,
            String winner,
            String resultHash,
            Map<String, BigInteger> stakes
    ) {}
}
