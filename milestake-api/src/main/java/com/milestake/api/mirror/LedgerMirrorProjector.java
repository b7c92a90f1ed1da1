package com.milestake.api.mirror;

import com.milestake.blockchain.contract.ChallengeSnapshot;
import com.milestake.blockchain.contract.LedgerEvent;
import com.milestake.blockchain.contract.LedgerEventListener;
import com.milestake.blockchain.contract.ParticipantSnapshot;
import com.milestake.blockchain.contract.SettlementLedger;
import com.milestake.core.domain.ChallengeSummary;
import com.milestake.core.domain.ParticipantSummary;
import com.milestake.core.repository.ChallengeSummaryRepository;
import com.milestake.core.repository.ParticipantSummaryRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Keeps the display mirror in step with the ledger.
 *
 * Each event re-projects the whole challenge from the ledger, so missed or
 * reordered events are repaired by the next one. The ledger stays
 * authoritative; nothing here feeds back into it.
 */
@Component
public class LedgerMirrorProjector implements LedgerEventListener {

    private static final Logger log = LoggerFactory.getLogger(LedgerMirrorProjector.class);

    private final SettlementLedger ledger;
    private final ChallengeSummaryRepository challengeRepository;
    private final ParticipantSummaryRepository participantRepository;
    private final TransactionTemplate transactions;
    private final Clock clock;

    public LedgerMirrorProjector(
            SettlementLedger ledger,
            ChallengeSummaryRepository challengeRepository,
            ParticipantSummaryRepository participantRepository,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.ledger = ledger;
        this.challengeRepository = challengeRepository;
        this.participantRepository = participantRepository;
        this.transactions = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @PostConstruct
    void register() {
        ledger.addListener(this);
    }

    @Override
    public void onEvent(LedgerEvent event) {
        if (event instanceof LedgerEvent.AttesterKeyUpdated) {
            return;
        }
        project(event.challengeId());
    }

    /**
     * Re-projects every challenge the ledger knows.
     *
     * @return number of challenges projected
     */
    public int rebuild() {
        long count = ledger.getChallengeCount();
        for (long challengeId = 0; challengeId < count; challengeId++) {
            project(challengeId);
        }
        log.info("Mirror rebuilt for {} challenges", count);
        return (int) count;
    }

    public void project(long challengeId) {
        String ledgerId = ledger.ledgerId();
        transactions.executeWithoutResult(status -> {
            ChallengeSnapshot challenge = ledger.getChallenge(challengeId);
            Instant now = clock.instant();

            ChallengeSummary summary = challengeRepository.findByLedgerIdAndChallengeId(ledgerId, challengeId)
                    .orElseGet(() -> ChallengeSummary.create(ledgerId, challengeId, challenge.creator(),
                            challenge.startTime(), challenge.endTime(), challenge.stakeAmount(),
                            challenge.whitelist().size(), now));
            summary.project(challenge.effectiveState().name(), challenge.totalStaked(),
                    challenge.participantCount(), challenge.winner(), challenge.resultHash(), now);
            challengeRepository.save(summary);

            for (ParticipantSnapshot participant : ledger.getParticipants(challengeId)) {
                ParticipantSummary row = participantRepository
                        .findByLedgerIdAndChallengeIdAndAddress(ledgerId, challengeId, participant.address())
                        .orElseGet(() -> ParticipantSummary.create(ledgerId, challengeId, participant.address(),
                                participant.correlationId(), participant.joinOrder(), participant.stake(),
                                participant.joinedAt()));
                row.updateStake(participant.stake());
                participantRepository.save(row);
            }
            log.debug("Projected challenge {} as {}", challengeId, challenge.effectiveState());
        });
    }
}
