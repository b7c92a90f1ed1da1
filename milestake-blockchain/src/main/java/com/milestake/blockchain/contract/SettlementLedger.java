package com.milestake.blockchain.contract;

import com.milestake.blockchain.signature.Addresses;
import com.milestake.blockchain.signature.ChallengeMessages;
import com.milestake.blockchain.signature.EthereumSignatures;
import com.milestake.blockchain.signature.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Escrow and state machine for staked mileage challenges.
 *
 * <p>Holds every participant's stake and releases it along exactly one of four paths:
 * an attested claim by the winner, the attester's two-step finalize/claim, a refund
 * after cancellation (consent or under-subscription), or an emergency withdrawal once
 * the emergency period has opened.
 *
 * <p>Lifecycle state is never advanced by a timer. Every operation derives the
 * effective state from the clock via {@link EffectiveStates} and writes a state only
 * when it needs to persist a fact. Operations on one challenge run one at a time
 * under that challenge's lock and are all-or-nothing: a rejected or failed operation
 * restores the challenge and publishes no events.
 *
 * <p>Challenge ids are only unique within one ledger. Anything stored outside the
 * ledger about a challenge must be keyed by {@link #ledgerId()} as well.
 */
public class SettlementLedger {

    private static final Logger log = LoggerFactory.getLogger(SettlementLedger.class);

    private final String ledgerId;
    private final Clock clock;
    private final SettlementPolicy policy;
    private final AttesterKeyRegistry attesterKeys;
    private final PayoutSink payoutSink;
    private final ConsentVerifier consentVerifier = new ConsentVerifier();

    private final Map<Long, ChallengeRecord> challenges = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final List<LedgerEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Object creationLock = new Object();
    private long nextChallengeId;

    public SettlementLedger(Clock clock, SettlementPolicy policy, String attester, PayoutSink payoutSink) {
        this(UUID.randomUUID().toString(), clock, policy, attester, payoutSink);
    }

    public SettlementLedger(String ledgerId, Clock clock, SettlementPolicy policy, String attester,
                            PayoutSink payoutSink) {
        if (ledgerId == null || ledgerId.isBlank()) {
            throw new IllegalArgumentException("Ledger id is required");
        }
        if (clock == null || policy == null || payoutSink == null) {
            throw new IllegalArgumentException("Clock, policy and payout sink are required");
        }
        this.ledgerId = ledgerId;
        this.clock = clock;
        this.policy = policy;
        this.attesterKeys = new AttesterKeyRegistry(attester);
        this.payoutSink = payoutSink;
    }

    /**
     * Identifies this ledger instance. A new instance starts numbering challenges at 0 again.
     */
    public String ledgerId() {
        return ledgerId;
    }

    public void addListener(LedgerEventListener listener) {
        listeners.add(listener);
    }

    // ==================== Creation ====================

    /**
     * Opens a challenge. The creator is always eligible and is added to the whitelist.
     *
     * @return the new challenge id
     */
    public long createChallenge(String creator, Instant startTime, Instant endTime,
                                BigInteger stakeAmount, List<String> otherEligible) {
        String creatorAddress = requireIdentity(creator, "creator");
        Instant now = clock.instant();

        if (startTime == null || !startTime.isAfter(now)) {
            throw invalid("Start time must be in the future");
        }
        if (endTime == null || !endTime.isAfter(startTime)) {
            throw invalid("End time must be after start time");
        }
        if (stakeAmount == null || stakeAmount.signum() <= 0) {
            throw invalid("Stake amount must be positive");
        }
        if (otherEligible == null || otherEligible.isEmpty()) {
            throw invalid("At least one other eligible participant is required");
        }

        Set<String> whitelist = new LinkedHashSet<>();
        whitelist.add(creatorAddress);
        for (String entry : otherEligible) {
            if (!Addresses.isValid(entry)) {
                throw invalid("Whitelist entry is missing or invalid: " + entry);
            }
            if (!whitelist.add(Addresses.normalize(entry))) {
                throw invalid("Whitelist entry is duplicated or equals the creator: " + entry);
            }
        }

        ChallengeRecord challenge;
        synchronized (creationLock) {
            challenge = new ChallengeRecord(nextChallengeId, creatorAddress, startTime, endTime,
                    stakeAmount, whitelist);
            challenges.put(challenge.getId(), challenge);
            nextChallengeId++;
        }

        log.info("Challenge {} created by {} ({} eligible, stake {})",
                challenge.getId(), creatorAddress, whitelist.size(), stakeAmount);
        publish(new LedgerEvent.ChallengeCreated(
                challenge.getId(), creatorAddress, startTime, endTime, stakeAmount));
        return challenge.getId();
    }

    // ==================== Participation ====================

    public void join(long challengeId, String caller, String correlationId, BigInteger stakeValue) {
        String participant = requireIdentity(caller, "caller");
        mutate(challengeId, (challenge, events) -> {
            Instant now = clock.instant();
            if (!challenge.isWhitelisted(participant)) {
                throw new LedgerException(LedgerError.NOT_ELIGIBLE,
                        participant + " is not on the whitelist of challenge " + challengeId);
            }
            if (EffectiveStates.resolve(challenge, now) != ChallengeState.PENDING) {
                throw new LedgerException(LedgerError.NOT_ACCEPTING_PARTICIPANTS,
                        "Challenge " + challengeId + " is not accepting participants");
            }
            if (!now.isBefore(challenge.getStartTime())) {
                throw new LedgerException(LedgerError.REGISTRATION_CLOSED,
                        "Registration for challenge " + challengeId + " has closed");
            }
            if (stakeValue == null || stakeValue.compareTo(challenge.getStakeAmount()) != 0) {
                throw new LedgerException(LedgerError.WRONG_STAKE_AMOUNT,
                        "Stake must be exactly " + challenge.getStakeAmount());
            }
            if (challenge.participant(participant).isPresent()) {
                throw new LedgerException(LedgerError.ALREADY_JOINED,
                        participant + " already joined challenge " + challengeId);
            }
            if (correlationId == null || correlationId.isBlank()) {
                throw new LedgerException(LedgerError.INVALID_CORRELATION_ID,
                        "Activity-service correlation id is required");
            }

            challenge.addParticipant(participant, correlationId, stakeValue, now);
            events.add(new LedgerEvent.ParticipantJoined(challengeId, participant, correlationId));
            log.info("Participant {} joined challenge {} ({}/{})", participant, challengeId,
                    challenge.getParticipantCount(), challenge.getWhitelist().size());
            return null;
        });
    }

    // ==================== Settlement ====================

    /**
     * Verifies an attestation and pays the whole pool to the claimant in one step.
     */
    public BigInteger claimWithAttestation(long challengeId, String claimant, Attestation attestation) {
        String winner = requireIdentity(claimant, "claimant");
        if (attestation == null) {
            throw invalid("Attestation is required");
        }
        if (attestation.challengeId() != challengeId) {
            throw invalid("Attestation was issued for challenge " + attestation.challengeId());
        }

        return mutate(challengeId, (challenge, events) -> {
            Instant now = clock.instant();
            requireGracePeriod(challenge, now);
            requireClaimWindowOpen(challenge, now);
            if (!Addresses.same(winner, attestation.winner())) {
                throw new LedgerException(LedgerError.NOT_WINNER,
                        winner + " is not the attested winner");
            }
            if (challenge.participant(winner).isEmpty()) {
                throw new LedgerException(LedgerError.NOT_PARTICIPANT,
                        winner + " did not join challenge " + challengeId);
            }
            if (Hashes.isEmpty(attestation.resultHash())) {
                throw new LedgerException(LedgerError.EMPTY_RESULT_HASH, "Result hash is empty");
            }
            requireFresh(attestation.signingTimestamp(), now);

            byte[] digest = ChallengeMessages.finalizeDigest(
                    challengeId, winner, attestation.resultHash(), attestation.signingTimestamp());
            String signer = EthereumSignatures.recoverSigner(digest, attestation.signature())
                    .orElseThrow(() -> new LedgerException(LedgerError.INVALID_SIGNATURE,
                            "Attestation signature does not verify"));
            if (!attesterKeys.isAttester(signer)) {
                throw new LedgerException(LedgerError.SIGNER_NOT_ATTESTER,
                        "Attestation was signed by " + signer + ", not the registered attester");
            }

            String resultHash = Hashes.normalize(attestation.resultHash());
            challenge.settle(ChallengeState.COMPLETED, winner, resultHash);
            BigInteger pool = challenge.releasePool();
            payoutSink.transfer(winner, pool);

            events.add(new LedgerEvent.ChallengeFinalized(challengeId, winner, resultHash));
            events.add(new LedgerEvent.PrizeClaimed(challengeId, winner, pool));
            log.info("Challenge {} completed by attested claim, {} paid to {}", challengeId, pool, winner);
            return pool;
        });
    }

    /**
     * Attester-driven finalization; the winner collects later with {@link #claimPrize}.
     */
    public void finalizeChallenge(String caller, long challengeId, String winner, String resultHash) {
        String attester = requireIdentity(caller, "caller");
        if (!attesterKeys.isAttester(attester)) {
            throw new LedgerException(LedgerError.NOT_ATTESTER, "Only the attester may finalize");
        }
        String winnerAddress = requireIdentity(winner, "winner");

        mutate(challengeId, (challenge, events) -> {
            Instant now = clock.instant();
            requireGracePeriod(challenge, now);
            requireClaimWindowOpen(challenge, now);
            if (challenge.participant(winnerAddress).isEmpty()) {
                throw new LedgerException(LedgerError.NOT_PARTICIPANT,
                        winnerAddress + " did not join challenge " + challengeId);
            }
            if (Hashes.isEmpty(resultHash)) {
                throw new LedgerException(LedgerError.EMPTY_RESULT_HASH, "Result hash is empty");
            }

            String normalizedHash = Hashes.normalize(resultHash);
            challenge.settle(ChallengeState.FINALIZED, winnerAddress, normalizedHash);
            events.add(new LedgerEvent.ChallengeFinalized(challengeId, winnerAddress, normalizedHash));
            log.info("Challenge {} finalized by attester, winner {}", challengeId, winnerAddress);
            return null;
        });
    }

    public BigInteger claimPrize(long challengeId, String caller) {
        String claimant = requireIdentity(caller, "caller");
        return mutate(challengeId, (challenge, events) -> {
            ChallengeState state = EffectiveStates.resolve(challenge, clock.instant());
            if (state == ChallengeState.COMPLETED) {
                throw new LedgerException(LedgerError.CHALLENGE_CLOSED,
                        "Prize for challenge " + challengeId + " was already paid");
            }
            if (state != ChallengeState.FINALIZED) {
                throw new LedgerException(LedgerError.NOT_FINALIZED,
                        "Challenge " + challengeId + " is " + state + ", not FINALIZED");
            }
            if (!Addresses.same(claimant, challenge.getWinner())) {
                throw new LedgerException(LedgerError.NOT_WINNER, claimant + " is not the winner");
            }

            challenge.settle(ChallengeState.COMPLETED, challenge.getWinner(), challenge.getResultHash());
            BigInteger pool = challenge.releasePool();
            payoutSink.transfer(claimant, pool);
            events.add(new LedgerEvent.PrizeClaimed(challengeId, claimant, pool));
            log.info("Prize of {} claimed for challenge {} by {}", pool, challengeId, claimant);
            return pool;
        });
    }

    // ==================== Consent and recovery ====================

    /**
     * Cancels a live challenge with one cancel signature from every joined participant.
     */
    public void cancelByConsent(long challengeId, List<String> signatures) {
        mutate(challengeId, (challenge, events) -> {
            ChallengeState state = EffectiveStates.resolve(challenge, clock.instant());
            if (state != ChallengeState.PENDING
                    && state != ChallengeState.ACTIVE
                    && state != ChallengeState.GRACE_PERIOD) {
                throw new LedgerException(LedgerError.CANNOT_CANCEL,
                        "Challenge " + challengeId + " is " + state + " and cannot be cancelled");
            }
            Set<String> joined = challenge.participantsInJoinOrder().stream()
                    .map(ParticipantRecord::getAddress)
                    .collect(Collectors.toSet());
            consentVerifier.verifyUnanimous(challengeId, signatures, joined);

            challenge.markStored(ChallengeState.CANCELLED);
            events.add(new LedgerEvent.ChallengeCancelled(challengeId));
            log.info("Challenge {} cancelled by consent of {} participants", challengeId, joined.size());
            return null;
        });
    }

    public BigInteger withdrawFromCancelled(long challengeId, String caller) {
        String participant = requireIdentity(caller, "caller");
        return mutate(challengeId, (challenge, events) -> {
            ChallengeState state = EffectiveStates.resolve(challenge, clock.instant());
            if (state != ChallengeState.CANCELLED) {
                throw new LedgerException(LedgerError.NOT_CANCELLED,
                        "Challenge " + challengeId + " is " + state + ", not CANCELLED");
            }
            ParticipantRecord record = requireStake(challenge, participant);

            if (challenge.getStoredState() != ChallengeState.CANCELLED) {
                challenge.markStored(ChallengeState.CANCELLED);
                events.add(new LedgerEvent.ChallengeCancelled(challengeId));
                log.info("Challenge {} cancelled: under-subscribed at start", challengeId);
            }
            BigInteger amount = challenge.releaseStake(record);
            payoutSink.transfer(participant, amount);
            events.add(new LedgerEvent.StakeWithdrawn(challengeId, participant, amount));
            return amount;
        });
    }

    /**
     * Returns a participant's stake once the emergency period has opened, whatever the
     * attester did or failed to do.
     */
    public BigInteger emergencyWithdraw(long challengeId, String caller) {
        String participant = requireIdentity(caller, "caller");
        return mutate(challengeId, (challenge, events) -> {
            Instant now = clock.instant();
            ChallengeState state = EffectiveStates.resolve(challenge, now);
            if (state.isTerminal()) {
                throw new LedgerException(LedgerError.CHALLENGE_CLOSED,
                        "Challenge " + challengeId + " is " + state);
            }
            Instant opensAt = challenge.getEndTime().plus(policy.emergencyPeriod());
            if (now.isBefore(opensAt)) {
                throw new LedgerException(LedgerError.EMERGENCY_PERIOD_NOT_REACHED,
                        "Emergency withdrawal opens at " + opensAt);
            }
            ParticipantRecord record = requireStake(challenge, participant);

            BigInteger amount = challenge.releaseStake(record);
            payoutSink.transfer(participant, amount);
            events.add(new LedgerEvent.EmergencyWithdrawal(challengeId, participant, amount));
            log.warn("Emergency withdrawal of {} from challenge {} by {}", amount, challengeId, participant);
            return amount;
        });
    }

    // ==================== Attester key ====================

    public long updateAttesterKey(String caller, String newAttester) {
        long version = attesterKeys.update(caller, newAttester);
        log.info("Attester key rotated to {} (version {})", attesterKeys.current(), version);
        publish(new LedgerEvent.AttesterKeyUpdated(-1, attesterKeys.current(), version));
        return version;
    }

    public String attesterAddress() {
        return attesterKeys.current();
    }

    public long attesterKeyVersion() {
        return attesterKeys.version();
    }

    // ==================== Reads ====================

    public ChallengeSnapshot getChallenge(long challengeId) {
        return read(challengeId, challenge -> challenge.snapshot(clock.instant()));
    }

    public ChallengeState effectiveState(long challengeId) {
        return read(challengeId, challenge -> EffectiveStates.resolve(challenge, clock.instant()));
    }

    public Optional<ParticipantSnapshot> getParticipant(long challengeId, String address) {
        String participant = requireIdentity(address, "address");
        return read(challengeId, challenge -> challenge.participant(participant).map(ParticipantRecord::snapshot));
    }

    /**
     * @return joined participants in join order
     */
    public List<ParticipantSnapshot> getParticipants(long challengeId) {
        return read(challengeId, challenge -> challenge.participantsInJoinOrder().stream()
                .map(ParticipantRecord::snapshot)
                .toList());
    }

    public List<String> getWhitelist(long challengeId) {
        return read(challengeId, challenge -> List.copyOf(challenge.getWhitelist()));
    }

    public boolean isEligible(long challengeId, String address) {
        String candidate = requireIdentity(address, "address");
        return read(challengeId, challenge -> challenge.isWhitelisted(candidate));
    }

    public long getChallengeCount() {
        synchronized (creationLock) {
            return nextChallengeId;
        }
    }

    // ==================== Internals ====================

    private <T> T mutate(long challengeId, BiFunction<ChallengeRecord, List<LedgerEvent>, T> operation) {
        ChallengeRecord challenge = require(challengeId);
        ReentrantLock lock = lockFor(challengeId);
        List<LedgerEvent> events = new ArrayList<>();
        T result;

        lock.lock();
        try {
            ChallengeRecord.Checkpoint checkpoint = challenge.checkpoint();
            try {
                result = operation.apply(challenge, events);
            } catch (RuntimeException e) {
                challenge.restore(checkpoint);
                throw e;
            }
        } finally {
            lock.unlock();
        }

        events.forEach(this::publish);
        return result;
    }

    private <T> T read(long challengeId, Function<ChallengeRecord, T> query) {
        ChallengeRecord challenge = require(challengeId);
        ReentrantLock lock = lockFor(challengeId);
        lock.lock();
        try {
            return query.apply(challenge);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(long challengeId) {
        return locks.computeIfAbsent(challengeId, id -> new ReentrantLock());
    }

    private ChallengeRecord require(long challengeId) {
        ChallengeRecord challenge = challenges.get(challengeId);
        if (challenge == null) {
            throw new LedgerException(LedgerError.CHALLENGE_NOT_FOUND,
                    "Challenge " + challengeId + " does not exist");
        }
        return challenge;
    }

    private void requireGracePeriod(ChallengeRecord challenge, Instant now) {
        ChallengeState state = EffectiveStates.resolve(challenge, now);
        if (state.isTerminal()) {
            throw new LedgerException(LedgerError.CHALLENGE_CLOSED,
                    "Challenge " + challenge.getId() + " is already " + state);
        }
        if (state != ChallengeState.GRACE_PERIOD) {
            throw new LedgerException(LedgerError.NOT_IN_GRACE_PERIOD,
                    "Challenge " + challenge.getId() + " is " + state + ", not GRACE_PERIOD");
        }
    }

    private void requireClaimWindowOpen(ChallengeRecord challenge, Instant now) {
        Instant closesAt = challenge.getEndTime().plus(policy.emergencyPeriod());
        if (!now.isBefore(closesAt)) {
            throw new LedgerException(LedgerError.CLAIM_WINDOW_CLOSED,
                    "Settlement window closed at " + closesAt + "; use emergency withdrawal");
        }
    }

    private void requireFresh(long signingTimestamp, Instant now) {
        long nowSeconds = now.getEpochSecond();
        if (signingTimestamp > nowSeconds) {
            throw new LedgerException(LedgerError.ATTESTATION_FROM_FUTURE,
                    "Attestation timestamp " + signingTimestamp + " is in the future");
        }
        // the timestamp is caller-supplied and may be any long; keep it out of arithmetic
        if (signingTimestamp <= nowSeconds - policy.attestationMaxAge().getSeconds()) {
            throw new LedgerException(LedgerError.ATTESTATION_EXPIRED,
                    "Attestation signed at " + signingTimestamp + " is too old");
        }
    }

    private ParticipantRecord requireStake(ChallengeRecord challenge, String participant) {
        return challenge.participant(participant)
                .filter(ParticipantRecord::hasStake)
                .orElseThrow(() -> new LedgerException(LedgerError.NO_STAKE_TO_WITHDRAW,
                        participant + " has no stake in challenge " + challenge.getId()));
    }

    private String requireIdentity(String address, String role) {
        if (!Addresses.isValid(address)) {
            throw invalid("Invalid " + role + " address: " + address);
        }
        return Addresses.normalize(address);
    }

    private static LedgerException invalid(String message) {
        return new LedgerException(LedgerError.INVALID_PARAMETERS, message);
    }

    private void publish(LedgerEvent event) {
        for (LedgerEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Ledger listener failed on {}", event, e);
            }
        }
    }
}
