package com.milestake.api.sync;

import com.milestake.api.config.OracleProperties;
import com.milestake.blockchain.contract.ChallengeSnapshot;
import com.milestake.blockchain.contract.ChallengeState;
import com.milestake.blockchain.contract.ParticipantSnapshot;
import com.milestake.blockchain.contract.SettlementLedger;
import com.milestake.core.domain.MileageSnapshot;
import com.milestake.core.repository.MileageSnapshotRepository;
import com.milestake.node.connector.ActivityConnector;
import com.milestake.node.connector.ActivityServiceException;
import com.milestake.node.connector.MileageReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Mileage Sync Service - records participants' mileage for running challenges.
 *
 * The hourly sweep covers every challenge whose window contains the current
 * time. Each participant's distance over {@code [start, min(now, end)]} is
 * appended as a snapshot; the latest snapshot wins. A failure for one
 * participant is counted and the sweep moves on.
 */
@Service
public class MileageSyncService {

    private static final Logger log = LoggerFactory.getLogger(MileageSyncService.class);

    private final SettlementLedger ledger;
    private final ActivityConnector connector;
    private final MileageSnapshotRepository snapshotRepository;
    private final Clock clock;
    private final Duration fetchTimeout;

    public MileageSyncService(
            SettlementLedger ledger,
            ActivityConnector connector,
            MileageSnapshotRepository snapshotRepository,
            OracleProperties properties,
            Clock clock) {
        this.ledger = ledger;
        this.connector = connector;
        this.snapshotRepository = snapshotRepository;
        this.clock = clock;
        this.fetchTimeout = properties.getFetchTimeout();
    }

    /**
     * Scheduled sweep. Runs hourly unless overridden.
     */
    @Scheduled(cron = "${milestake.oracle.sync-cron:0 0 * * * *}")
    public void scheduledSweep() {
        SweepSummary summary = syncActiveChallenges();
        log.info("Mileage sweep finished: {} challenges, {} snapshots, {} failures",
                summary.challenges(), summary.synced(), summary.failed());
    }

    public SweepSummary syncActiveChallenges() {
        int challenges = 0;
        int synced = 0;
        int failed = 0;
        for (long challengeId = 0; challengeId < ledger.getChallengeCount(); challengeId++) {
            if (ledger.effectiveState(challengeId) != ChallengeState.ACTIVE) {
                continue;
            }
            try {
                ChallengeSyncResult result = syncChallenge(challengeId);
                challenges++;
                synced += result.synced();
                failed += result.failed();
            } catch (RuntimeException e) {
                log.error("Mileage sync for challenge {} failed", challengeId, e);
            }
        }
        return new SweepSummary(challenges, synced, failed);
    }

    /**
     * Fetches and records mileage for every participant of one challenge.
     *
     * @throws ChallengeNotStartedException if the challenge window has not opened
     */
    public ChallengeSyncResult syncChallenge(long challengeId) {
        ChallengeSnapshot challenge = ledger.getChallenge(challengeId);
        Instant now = clock.instant();
        if (now.isBefore(challenge.startTime())) {
            throw new ChallengeNotStartedException(challengeId);
        }
        Instant windowStart = challenge.startTime();
        Instant windowEnd = now.isBefore(challenge.endTime()) ? now : challenge.endTime();

        Map<ParticipantSnapshot, CompletableFuture<MileageReading>> pending = new LinkedHashMap<>();
        for (ParticipantSnapshot participant : ledger.getParticipants(challengeId)) {
            pending.put(participant, connector.fetchMileage(
                    participant.address(), participant.correlationId(), windowStart, windowEnd));
        }

        List<ParticipantSyncResult> results = new ArrayList<>();
        int synced = 0;
        for (Map.Entry<ParticipantSnapshot, CompletableFuture<MileageReading>> entry : pending.entrySet()) {
            String address = entry.getKey().address();
            try {
                MileageReading reading = entry.getValue().get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
                snapshotRepository.save(MileageSnapshot.record(ledger.ledgerId(), challengeId, address,
                        reading.miles(), reading.sampleCount(), windowStart, windowEnd, clock.instant()));
                results.add(ParticipantSyncResult.synced(address, reading.miles()));
                synced++;
            } catch (ExecutionException e) {
                results.add(ParticipantSyncResult.failed(address, describe(e.getCause())));
                log.warn("Mileage fetch for {} in challenge {} failed: {}",
                        address, challengeId, e.getCause().getMessage());
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                results.add(ParticipantSyncResult.failed(address, "TIMEOUT"));
                log.warn("Mileage fetch for {} in challenge {} timed out after {}",
                        address, challengeId, fetchTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Mileage sync interrupted", e);
            }
        }

        int failed = results.size() - synced;
        log.info("Challenge {} synced over [{}, {}]: {} recorded, {} failed",
                challengeId, windowStart, windowEnd, synced, failed);
        return new ChallengeSyncResult(challengeId, windowStart, windowEnd, synced, failed, results);
    }

    private static String describe(Throwable cause) {
        if (cause instanceof ActivityServiceException serviceException) {
            return serviceException.getErrorCode();
        }
        return cause.getClass().getSimpleName();
    }

    // DTOs

    public record SweepSummary(int challenges, int synced, int failed) {}

    public record ChallengeSyncResult(
            long challengeId,
            Instant windowStart,
            Instant windowEnd,
            int synced,
            int failed,
            List<ParticipantSyncResult> participants
    ) {}

    public record ParticipantSyncResult(String walletAddress, BigDecimal miles, String error) {
        static ParticipantSyncResult synced(String walletAddress, BigDecimal miles) {
            return new ParticipantSyncResult(walletAddress, miles, null);
        }

        static ParticipantSyncResult failed(String walletAddress, String error) {
            return new ParticipantSyncResult(walletAddress, null, error);
        }
    }

    // Exceptions

    public static class ChallengeNotStartedException extends RuntimeException {
        public ChallengeNotStartedException(long challengeId) {
            super("Challenge " + challengeId + " has not started yet");
        }
    }
}
