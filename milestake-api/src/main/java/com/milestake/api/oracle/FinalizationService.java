package com.milestake.api.oracle;

import com.milestake.blockchain.contract.Attestation;
import com.milestake.blockchain.contract.ChallengeSnapshot;
import com.milestake.blockchain.contract.ChallengeState;
import com.milestake.blockchain.contract.ParticipantSnapshot;
import com.milestake.blockchain.contract.SettlementLedger;
import com.milestake.core.domain.FinalizationDecision;
import com.milestake.core.domain.FinalizationDecision.Trigger;
import com.milestake.core.domain.MileageConfirmation;
import com.milestake.core.domain.MileageSnapshot;
import com.milestake.core.repository.FinalizationDecisionRepository;
import com.milestake.core.repository.MileageConfirmationRepository;
import com.milestake.core.repository.MileageSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Finalization Service - decides challenge winners and signs attestations.
 *
 * The first decision for a challenge is persisted; later requests re-sign the
 * same winner and result hash with a fresh timestamp. Requests for the same
 * challenge are serialized.
 */
@Service
public class FinalizationService {

    private static final Logger log = LoggerFactory.getLogger(FinalizationService.class);

    private final SettlementLedger ledger;
    private final MileageSnapshotRepository snapshotRepository;
    private final MileageConfirmationRepository confirmationRepository;
    private final FinalizationDecisionRepository decisionRepository;
    private final FinalizationPolicy policy;
    private final AttesterSigner signer;
    private final TransactionTemplate transactions;
    private final Clock clock;
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FinalizationService(
            SettlementLedger ledger,
            MileageSnapshotRepository snapshotRepository,
            MileageConfirmationRepository confirmationRepository,
            FinalizationDecisionRepository decisionRepository,
            FinalizationPolicy policy,
            AttesterSigner signer,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.ledger = ledger;
        this.snapshotRepository = snapshotRepository;
        this.confirmationRepository = confirmationRepository;
        this.decisionRepository = decisionRepository;
        this.policy = policy;
        this.signer = signer;
        this.transactions = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Evaluates a challenge and, when it may be finalized, returns a signed attestation.
     *
     * @throws ChallengeCancelledException if the challenge can no longer be settled
     * @throws MileageUnavailableException if no mileage has been recorded for anyone yet
     */
    public FinalizationOutcome requestFinalization(long challengeId) {
        ReentrantLock lock = locks.computeIfAbsent(challengeId, id -> new ReentrantLock());
        lock.lock();
        try {
            return transactions.execute(status -> decide(challengeId));
        } finally {
            lock.unlock();
        }
    }

    private FinalizationOutcome decide(long challengeId) {
        String ledgerId = ledger.ledgerId();
        ChallengeSnapshot challenge = ledger.getChallenge(challengeId);
        if (challenge.effectiveState() == ChallengeState.CANCELLED) {
            throw new ChallengeCancelledException(challengeId);
        }

        List<ParticipantSnapshot> participants = ledger.getParticipants(challengeId);
        Set<String> confirmed = confirmationRepository.findByLedgerIdAndChallengeId(ledgerId, challengeId).stream()
                .map(MileageConfirmation::getAddress)
                .collect(Collectors.toSet());
        int confirmedCount = (int) participants.stream()
                .filter(participant -> confirmed.contains(participant.address()))
                .count();

        Instant now = clock.instant();
        FinalizationPolicy.Eligibility eligibility =
                policy.evaluate(now, challenge.endTime(), confirmedCount, participants.size());
        if (!eligibility.eligible()) {
            log.debug("Challenge {} not finalizable: {}", challengeId, eligibility.reason());
            return new FinalizationRefusal(challengeId, eligibility.reason(), eligibility.secondsUntilEligible(),
                    eligibility.confirmedCount(), eligibility.totalParticipants());
        }

        Optional<FinalizationDecision> recorded = decisionRepository.findByLedgerIdAndChallengeId(ledgerId, challengeId);
        recorded.ifPresent(existing -> requireMatchesLedger(existing, challengeId, participants));
        FinalizationDecision decision = recorded
                .orElseGet(() -> decideWinner(challengeId, participants, confirmed, eligibility.trigger(), now));
        ParticipantSnapshot winner = participants.stream()
                .filter(participant -> participant.address().equals(decision.getWinner()))
                .findFirst()
                .orElseThrow(() -> new DecisionMismatchException(challengeId,
                        "recorded winner " + decision.getWinner() + " is not a participant"));

        Attestation attestation = signer.sign(challengeId, decision.getWinner(), decision.getResultHash(),
                now.getEpochSecond());

        log.info("Signed finalization for challenge {}: winner {} ({} miles, {})",
                challengeId, decision.getWinner(), decision.getWinnerMiles(), eligibility.trigger());
        return new FinalizationResult(
                challengeId,
                new WinnerView(winner.address(), winner.correlationId(), decision.getWinnerMiles(),
                        confirmed.contains(winner.address())),
                eligibility.trigger(),
                eligibility.confirmedCount(),
                eligibility.totalParticipants(),
                decision.getResultHash(),
                decision.getResultJson(),
                attestation.signingTimestamp(),
                attestation.signature(),
                signer.address());
    }

    /**
     * A recorded decision is only re-signed while it still describes the ledger's
     * participants, in join order.
     */
    private void requireMatchesLedger(FinalizationDecision decision, long challengeId,
                                      List<ParticipantSnapshot> participants) {
        List<String> live = participants.stream()
                .sorted(Comparator.comparingInt(ParticipantSnapshot::joinOrder))
                .map(ParticipantSnapshot::address)
                .toList();
        List<String> decided = ResultDigest.addresses(decision.getResultJson());
        if (!live.equals(decided)) {
            log.error("Recorded decision for challenge {} lists {} but the ledger has {}", challengeId, decided, live);
            throw new DecisionMismatchException(challengeId, "participants differ from the ledger");
        }
    }

    private FinalizationDecision decideWinner(long challengeId, List<ParticipantSnapshot> participants,
                                              Set<String> confirmed, Trigger trigger, Instant now) {
        List<ParticipantStanding> standings = new ArrayList<>();
        boolean anyMileage = false;
        for (ParticipantSnapshot participant : participants) {
            Optional<MileageSnapshot> latest = snapshotRepository
                    .findFirstByLedgerIdAndChallengeIdAndAddressOrderByRecordedAtDescIdDesc(
                            ledger.ledgerId(), challengeId, participant.address());
            anyMileage |= latest.isPresent();
            standings.add(new ParticipantStanding(
                    participant.address(),
                    participant.correlationId(),
                    participant.joinOrder(),
                    latest.map(MileageSnapshot::getMiles).orElse(BigDecimal.ZERO),
                    confirmed.contains(participant.address())));
        }
        if (!anyMileage) {
            throw new MileageUnavailableException(challengeId);
        }

        ParticipantStanding winner = WinnerSelector.select(standings);
        ResultDigest.Result result = ResultDigest.of(standings);
        FinalizationDecision decision = decisionRepository.save(FinalizationDecision.create(ledger.ledgerId(),
                challengeId, winner.address(), winner.miles(), result.hash(), result.json(), trigger, now));

        log.info("Challenge {} decided: winner {} with {} miles, result {}",
                challengeId, winner.address(), winner.miles(), result.hash());
        return decision;
    }

    // DTOs

    public sealed interface FinalizationOutcome permits FinalizationResult, FinalizationRefusal {
        long challengeId();
    }

    public record FinalizationResult(
            long challengeId,
            WinnerView winner,
            Trigger trigger,
            int confirmedCount,
            int totalParticipants,
            String resultHash,
            String results,
            long signingTimestamp,
            String signature,
            String attesterAddress
    ) implements FinalizationOutcome {}

    public record FinalizationRefusal(
            long challengeId,
            String reason,
            long secondsUntilEligible,
            int confirmedCount,
            int totalParticipants
    ) implements FinalizationOutcome {}

    public record WinnerView(String address, String correlationId, BigDecimal miles, boolean confirmed) {}

    // Exceptions

    public static class ChallengeCancelledException extends RuntimeException {
        public ChallengeCancelledException(long challengeId) {
            super("Challenge " + challengeId + " is cancelled");
        }
    }

    /**
     * A stored decision no longer describes the challenge on the ledger; nothing is signed.
     */
    public static class DecisionMismatchException extends RuntimeException {
        public DecisionMismatchException(long challengeId, String detail) {
            super("Recorded decision for challenge " + challengeId + " cannot be used: " + detail);
        }
    }

    /**
     * Retryable: a mileage sync has not yet recorded anything for the challenge.
     */
    public static class MileageUnavailableException extends RuntimeException {
        public MileageUnavailableException(long challengeId) {
            super("No mileage recorded yet for challenge " + challengeId);
        }
    }
}
