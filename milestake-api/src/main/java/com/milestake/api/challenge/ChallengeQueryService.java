package com.milestake.api.challenge;

import com.milestake.api.oracle.ParticipantStanding;
import com.milestake.api.oracle.WinnerSelector;
import com.milestake.blockchain.contract.ChallengeSnapshot;
import com.milestake.blockchain.contract.ParticipantSnapshot;
import com.milestake.blockchain.contract.SettlementLedger;
import com.milestake.core.domain.ChallengeSummary;
import com.milestake.core.domain.MileageConfirmation;
import com.milestake.core.domain.MileageSnapshot;
import com.milestake.core.repository.ChallengeSummaryRepository;
import com.milestake.core.repository.MileageConfirmationRepository;
import com.milestake.core.repository.MileageSnapshotRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side for challenges: the display mirror for listings, the ledger for
 * live state, and recorded mileage and confirmations for standings.
 */
@Service
@Transactional(readOnly = true)
public class ChallengeQueryService {

    private final SettlementLedger ledger;
    private final ChallengeSummaryRepository summaryRepository;
    private final MileageSnapshotRepository snapshotRepository;
    private final MileageConfirmationRepository confirmationRepository;

    public ChallengeQueryService(
            SettlementLedger ledger,
            ChallengeSummaryRepository summaryRepository,
            MileageSnapshotRepository snapshotRepository,
            MileageConfirmationRepository confirmationRepository) {
        this.ledger = ledger;
        this.summaryRepository = summaryRepository;
        this.snapshotRepository = snapshotRepository;
        this.confirmationRepository = confirmationRepository;
    }

    /**
     * Newest first. The state shown is the ledger's current effective state.
     */
    public List<ChallengeSummaryDto> listChallenges() {
        return summaryRepository.findByLedgerIdOrderByChallengeIdDesc(ledger.ledgerId()).stream()
                .map(this::toDto)
                .toList();
    }

    public ChallengeSummaryDto getChallenge(long challengeId) {
        return summaryRepository.findByLedgerIdAndChallengeId(ledger.ledgerId(), challengeId)
                .map(this::toDto)
                .orElseThrow(() -> new ChallengeNotFoundException(challengeId));
    }

    /**
     * Participants in join order with their latest recorded mileage.
     */
    public ParticipantsView getParticipants(long challengeId) {
        List<ParticipantView> participants = new ArrayList<>();
        for (Standing standing : standings(challengeId)) {
            participants.add(new ParticipantView(
                    standing.participant().address(),
                    standing.participant().correlationId(),
                    standing.participant().joinOrder(),
                    standing.participant().stake(),
                    standing.participant().joinedAt(),
                    standing.confirmed(),
                    standing.miles(),
                    standing.lastUpdate()));
        }
        long confirmed = participants.stream().filter(ParticipantView::confirmed).count();
        return new ParticipantsView(challengeId, participants,
                new ConfirmationStats(participants.size(), confirmed,
                        !participants.isEmpty() && confirmed == participants.size()));
    }

    /**
     * Best first: most miles, ties to the earliest joiner.
     */
    public List<LeaderboardEntry> getLeaderboard(long challengeId) {
        List<ParticipantStanding> ranked = WinnerSelector.rank(standings(challengeId).stream()
                .map(standing -> new ParticipantStanding(
                        standing.participant().address(),
                        standing.participant().correlationId(),
                        standing.participant().joinOrder(),
                        standing.miles(),
                        standing.confirmed()))
                .toList());

        List<LeaderboardEntry> leaderboard = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            ParticipantStanding entry = ranked.get(i);
            leaderboard.add(new LeaderboardEntry(i + 1, entry.address(), entry.correlationId(),
                    entry.miles(), entry.confirmed()));
        }
        return leaderboard;
    }

    private List<Standing> standings(long challengeId) {
        List<ParticipantSnapshot> participants = ledger.getParticipants(challengeId);
        Set<String> confirmed = confirmationRepository
                .findByLedgerIdAndChallengeId(ledger.ledgerId(), challengeId).stream()
                .map(MileageConfirmation::getAddress)
                .collect(Collectors.toSet());

        List<Standing> standings = new ArrayList<>();
        for (ParticipantSnapshot participant : participants) {
            Optional<MileageSnapshot> latest = snapshotRepository
                    .findFirstByLedgerIdAndChallengeIdAndAddressOrderByRecordedAtDescIdDesc(
                            ledger.ledgerId(), challengeId, participant.address());
            standings.add(new Standing(
                    participant,
                    confirmed.contains(participant.address()),
                    latest.map(MileageSnapshot::getMiles).orElse(BigDecimal.ZERO.setScale(2)),
                    latest.map(MileageSnapshot::getRecordedAt).orElse(null)));
        }
        return standings;
    }

    private ChallengeSummaryDto toDto(ChallengeSummary summary) {
        ChallengeSnapshot live = ledger.getChallenge(summary.getChallengeId());
        return new ChallengeSummaryDto(
                summary.getChallengeId(),
                summary.getCreator(),
                summary.getStartTime(),
                summary.getEndTime(),
                summary.getStakeAmount(),
                live.totalStaked(),
                live.effectiveState().name(),
                live.winner(),
                live.resultHash(),
                live.participantCount(),
                summary.getWhitelistSize(),
                summary.getProjectedAt());
    }

    private record Standing(ParticipantSnapshot participant, boolean confirmed, BigDecimal miles,
                            Instant lastUpdate) {}

    // DTOs

    public record ChallengeSummaryDto(
            long challengeId,
            String creator,
            Instant startTime,
            Instant endTime,
            BigInteger stakeAmount,
            BigInteger totalStaked,
            String state,
            String winner,
            String resultHash,
            int participantCount,
            int whitelistSize,
            Instant projectedAt
    ) {}

    public record ParticipantView(
            String walletAddress,
            String correlationId,
            int joinOrder,
            BigInteger stake,
            Instant joinedAt,
            boolean confirmed,
            BigDecimal currentMiles,
            Instant lastUpdate
    ) {}

    public record ConfirmationStats(int total, long confirmed, boolean allConfirmed) {}

    public record ParticipantsView(long challengeId, List<ParticipantView> participants, ConfirmationStats stats) {}

    public record LeaderboardEntry(int rank, String walletAddress, String correlationId, BigDecimal miles,
                                   boolean confirmed) {}

    // Exceptions

    public static class ChallengeNotFoundException extends RuntimeException {
        public ChallengeNotFoundException(long challengeId) {
            super("Challenge not found: " + challengeId);
        }
    }
}
