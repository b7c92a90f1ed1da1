package com.milestake.blockchain.contract;

import com.milestake.blockchain.signature.ChallengeMessages;
import com.milestake.blockchain.signature.EthereumSignatures;
import com.milestake.blockchain.signature.Hashes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.milestake.blockchain.contract.TestAccounts.*;
import static org.assertj.core.api.Assertions.*;

class SettlementLedgerTest {

    private static final BigInteger UNIT = BigInteger.TEN.pow(18);
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");
    private static final Instant START = NOW.plus(Duration.ofDays(1));
    private static final Instant END = START.plus(Duration.ofDays(7));
    private static final String RESULT = Hashes.keccak256("[{\"address\":\"a\"}]");

    private final String alice = address(ALICE);
    private final String bob = address(BOB);
    private final String carol = address(CAROL);
    private final String mallory = address(MALLORY);

    private MutableClock clock;
    private InMemoryPayoutSink payouts;
    private SettlementLedger ledger;
    private List<LedgerEvent> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        payouts = new InMemoryPayoutSink();
        ledger = new SettlementLedger(clock, SettlementPolicy.defaults(), address(ATTESTER), payouts);
        events = new ArrayList<>();
        ledger.addListener(events::add);
    }

    private long createThreeWay() {
        return ledger.createChallenge(alice, START, END, UNIT, List.of(bob, carol));
    }

    private long createAndFill() {
        long id = createThreeWay();
        ledger.join(id, alice, "strava-1", UNIT);
        ledger.join(id, bob, "strava-2", UNIT);
        ledger.join(id, carol, "strava-3", UNIT);
        return id;
    }

    private Attestation attest(Credentials signer, long id, String winner, String resultHash, long timestamp) {
        String signature = EthereumSignatures.sign(
                ChallengeMessages.finalizeDigest(id, winner, resultHash, timestamp), signer);
        return new Attestation(id, winner, resultHash, timestamp, signature);
    }

    private Attestation attestNow(long id, String winner) {
        return attest(ATTESTER, id, winner, RESULT, clock.instant().getEpochSecond());
    }

    private static LedgerError errorOf(Throwable thrown) {
        return ((LedgerException) thrown).getError();
    }

    // ==================== Creation ====================

    @Nested
    class Creation {

        @Test
        void allocatesSequentialIdsAndWhitelistsCreator() {
            long first = createThreeWay();
            long second = ledger.createChallenge(bob, START, END, UNIT, List.of(carol));

            assertThat(first).isZero();
            assertThat(second).isEqualTo(1);
            assertThat(ledger.getChallengeCount()).isEqualTo(2);
            assertThat(ledger.getWhitelist(first)).containsExactly(alice, bob, carol);
            assertThat(ledger.isEligible(first, alice)).isTrue();
            assertThat(ledger.isEligible(first, mallory)).isFalse();

            ChallengeSnapshot snapshot = ledger.getChallenge(first);
            assertThat(snapshot.effectiveState()).isEqualTo(ChallengeState.PENDING);
            assertThat(snapshot.totalStaked()).isZero();
            assertThat(snapshot.participantCount()).isZero();
            assertThat(events).first().isInstanceOf(LedgerEvent.ChallengeCreated.class);
        }

        @Test
        void rejectsInvalidParameters() {
            assertThatThrownBy(() -> ledger.createChallenge(alice, NOW, END, UNIT, List.of(bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));
            assertThatThrownBy(() -> ledger.createChallenge(alice, START, START, UNIT, List.of(bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));
            assertThatThrownBy(() -> ledger.createChallenge(alice, START, END, BigInteger.ZERO, List.of(bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));
            assertThatThrownBy(() -> ledger.createChallenge(alice, START, END, UNIT, List.of()))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));
            assertThatThrownBy(() -> ledger.createChallenge(alice, START, END, UNIT, List.of(bob, bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));
            assertThatThrownBy(() -> ledger.createChallenge(alice, START, END, UNIT, List.of(alice)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));
            assertThatThrownBy(() -> ledger.createChallenge(alice, START, END, UNIT,
                    List.of("0x0000000000000000000000000000000000000000")))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));
            assertThatThrownBy(() -> ledger.createChallenge("alice", START, END, UNIT, List.of(bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));

            assertThat(ledger.getChallengeCount()).isZero();
            assertThat(events).isEmpty();
        }

        @Test
        void unknownChallengeIsNamed() {
            assertThatThrownBy(() -> ledger.getChallenge(42))
                    .isInstanceOf(LedgerException.class)
                    .hasMessageContaining("CHALLENGE_NOT_FOUND");
        }
    }

    // ==================== Joining ====================

    @Nested
    class Joining {

        @Test
        void joinAddsStakeInJoinOrder() {
            long id = createThreeWay();
            ledger.join(id, bob, "strava-2", UNIT);
            ledger.join(id, alice, "strava-1", UNIT);

            assertThat(ledger.getChallenge(id).totalStaked()).isEqualTo(UNIT.multiply(BigInteger.TWO));
            assertThat(ledger.getParticipants(id))
                    .extracting(ParticipantSnapshot::address)
                    .containsExactly(bob, alice);
            assertThat(ledger.getParticipant(id, alice)).hasValueSatisfying(p -> {
                assertThat(p.correlationId()).isEqualTo("strava-1");
                assertThat(p.stake()).isEqualTo(UNIT);
                assertThat(p.joinOrder()).isEqualTo(1);
            });
            assertThat(ledger.getParticipant(id, carol)).isEmpty();
        }

        @Test
        void eachPreconditionHasItsOwnError() {
            long id = createThreeWay();
            ledger.join(id, alice, "strava-1", UNIT);

            assertThatThrownBy(() -> ledger.join(id, mallory, "strava-9", UNIT))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_ELIGIBLE));
            assertThatThrownBy(() -> ledger.join(id, bob, "strava-2", UNIT.add(BigInteger.ONE)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.WRONG_STAKE_AMOUNT));
            assertThatThrownBy(() -> ledger.join(id, alice, "strava-1", UNIT))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.ALREADY_JOINED));
            assertThatThrownBy(() -> ledger.join(id, bob, " ", UNIT))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_CORRELATION_ID));

            assertThat(ledger.getChallenge(id).participantCount()).isEqualTo(1);
        }

        @Test
        void joiningAfterPendingAlwaysFails() {
            long id = createThreeWay();
            ledger.join(id, alice, "strava-1", UNIT);
            ledger.join(id, bob, "strava-2", UNIT);
            clock.set(START);

            assertThatThrownBy(() -> ledger.join(id, carol, "strava-3", UNIT))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_ACCEPTING_PARTICIPANTS));

            long full = ledger.createChallenge(alice, START.plusSeconds(60), END, UNIT, List.of(bob));
            ledger.join(full, alice, "strava-1", UNIT);
            ledger.join(full, bob, "strava-2", UNIT);
            clock.set(START.plusSeconds(60));
            assertThat(ledger.effectiveState(full)).isEqualTo(ChallengeState.ACTIVE);
            assertThatThrownBy(() -> ledger.join(full, bob, "strava-2", UNIT))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_ACCEPTING_PARTICIPANTS));
        }
    }

    // ==================== Under-subscription ====================

    @Test
    void underSubscribedChallengeRefundsJoinedParticipants() {
        long id = createThreeWay();
        ledger.join(id, alice, "strava-1", UNIT);
        ledger.join(id, bob, "strava-2", UNIT);

        clock.set(START);
        assertThat(ledger.effectiveState(id)).isEqualTo(ChallengeState.CANCELLED);
        assertThat(ledger.getChallenge(id).storedState()).isEqualTo(ChallengeState.PENDING);

        assertThat(ledger.withdrawFromCancelled(id, alice)).isEqualTo(UNIT);
        assertThat(ledger.withdrawFromCancelled(id, bob)).isEqualTo(UNIT);
        assertThatThrownBy(() -> ledger.withdrawFromCancelled(id, carol))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NO_STAKE_TO_WITHDRAW));
        assertThatThrownBy(() -> ledger.withdrawFromCancelled(id, alice))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NO_STAKE_TO_WITHDRAW));

        assertThat(payouts.receivedBy(alice)).isEqualTo(UNIT);
        assertThat(payouts.receivedBy(bob)).isEqualTo(UNIT);
        assertThat(ledger.getChallenge(id).storedState()).isEqualTo(ChallengeState.CANCELLED);
        assertThat(ledger.getChallenge(id).totalStaked()).isZero();
        assertThat(events).filteredOn(LedgerEvent.ChallengeCancelled.class::isInstance).hasSize(1);
    }

    @Test
    void withdrawRequiresCancellation() {
        long id = createAndFill();
        clock.set(START);

        assertThatThrownBy(() -> ledger.withdrawFromCancelled(id, alice))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_CANCELLED));
    }

    // ==================== Attested claim ====================

    @Nested
    class AttestedClaim {

        @Test
        void winnerCollectsWholePoolExactlyOnce() {
            long id = createAndFill();
            clock.set(END);
            Attestation attestation = attestNow(id, bob);

            assertThat(ledger.claimWithAttestation(id, bob, attestation)).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));

            ChallengeSnapshot snapshot = ledger.getChallenge(id);
            assertThat(snapshot.effectiveState()).isEqualTo(ChallengeState.COMPLETED);
            assertThat(snapshot.winner()).isEqualTo(bob);
            assertThat(snapshot.resultHash()).isEqualTo(RESULT);
            assertThat(snapshot.totalStaked()).isZero();
            assertThat(payouts.receivedBy(bob)).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));

            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, attestation))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.CHALLENGE_CLOSED));
            assertThat(payouts.totalPaidOut()).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
            assertThat(events).filteredOn(LedgerEvent.PrizeClaimed.class::isInstance).hasSize(1);
        }

        @Test
        void claimOnlyDuringGracePeriod() {
            long id = createAndFill();
            clock.set(END.minusSeconds(1));

            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, attestNow(id, bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_IN_GRACE_PERIOD));

            clock.set(END.plus(Duration.ofDays(14)));
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, attestNow(id, bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.CLAIM_WINDOW_CLOSED));
        }

        @Test
        void onlyTheAttestedParticipantMayClaim() {
            long id = createAndFill();
            clock.set(END);

            assertThatThrownBy(() -> ledger.claimWithAttestation(id, alice, attestNow(id, bob)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_WINNER));
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, mallory, attestNow(id, mallory)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_PARTICIPANT));
        }

        @Test
        void rejectsEmptyCommitmentAndStaleTimestamps() {
            long id = createAndFill();
            clock.set(END.plus(Duration.ofDays(1)));
            long now = clock.instant().getEpochSecond();

            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, attest(ATTESTER, id, bob, Hashes.EMPTY, now)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.EMPTY_RESULT_HASH));
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, attest(ATTESTER, id, bob, RESULT, now + 1)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.ATTESTATION_FROM_FUTURE));

            long maxAge = Duration.ofDays(30).getSeconds();
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, attest(ATTESTER, id, bob, RESULT, now - maxAge)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.ATTESTATION_EXPIRED));
            assertThat(ledger.claimWithAttestation(id, bob, attest(ATTESTER, id, bob, RESULT, now - maxAge + 1)))
                    .isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
        }

        @Test
        void extremeTimestampsAreRejectedAsLedgerErrors() {
            long id = createAndFill();
            clock.set(END.plus(Duration.ofDays(1)));
            String unverified = "0x" + "11".repeat(65);

            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob,
                    new Attestation(id, bob, RESULT, Long.MIN_VALUE, unverified)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.ATTESTATION_EXPIRED));
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob,
                    new Attestation(id, bob, RESULT, Long.MAX_VALUE, unverified)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.ATTESTATION_FROM_FUTURE));
            assertThat(ledger.getChallenge(id).totalStaked()).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
        }

        @Test
        void rejectsForgedAndTamperedAttestations() {
            long id = createAndFill();
            clock.set(END);
            long now = clock.instant().getEpochSecond();

            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, attest(MALLORY, id, bob, RESULT, now)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.SIGNER_NOT_ATTESTER));

            Attestation genuine = attestNow(id, bob);
            Attestation tampered = new Attestation(id, bob, Hashes.keccak256("other"), now, genuine.signature());
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, tampered))
                    .satisfies(e -> assertThat(errorOf(e).category()).isEqualTo(LedgerError.Category.AUTHORIZATION));

            Attestation garbage = new Attestation(id, bob, RESULT, now, "0x1234");
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, garbage))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_SIGNATURE));

            Attestation otherChallenge = attestNow(id + 1, bob);
            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, otherChallenge))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));

            assertThat(ledger.getChallenge(id).effectiveState()).isEqualTo(ChallengeState.GRACE_PERIOD);
        }

        @Test
        void cancelSignatureCannotBeReplayedAsFinalization() {
            long id = createAndFill();
            clock.set(END);
            String cancelSignature = EthereumSignatures.sign(ChallengeMessages.cancelDigest(id), ATTESTER);
            Attestation replay = new Attestation(id, bob, RESULT, clock.instant().getEpochSecond(), cancelSignature);

            assertThatThrownBy(() -> ledger.claimWithAttestation(id, bob, replay))
                    .satisfies(e -> assertThat(errorOf(e).category()).isEqualTo(LedgerError.Category.AUTHORIZATION));
            assertThat(ledger.getChallenge(id).totalStaked()).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
        }

        @Test
        void failedPayoutLeavesChallengeUntouched() {
            PayoutSink failing = (recipient, amount) -> {
                throw new IllegalStateException("transfer rejected");
            };
            SettlementLedger strict = new SettlementLedger(clock, SettlementPolicy.defaults(), address(ATTESTER), failing);
            List<LedgerEvent> published = new ArrayList<>();
            strict.addListener(published::add);

            long id = strict.createChallenge(alice, START, END, UNIT, List.of(bob));
            strict.join(id, alice, "strava-1", UNIT);
            strict.join(id, bob, "strava-2", UNIT);
            published.clear();
            clock.set(END);

            assertThatThrownBy(() -> strict.claimWithAttestation(id, alice, attestNow(id, alice)))
                    .isInstanceOf(IllegalStateException.class);

            ChallengeSnapshot snapshot = strict.getChallenge(id);
            assertThat(snapshot.storedState()).isEqualTo(ChallengeState.PENDING);
            assertThat(snapshot.winner()).isNull();
            assertThat(snapshot.totalStaked()).isEqualTo(UNIT.multiply(BigInteger.TWO));
            assertThat(strict.getParticipants(id)).allSatisfy(p -> assertThat(p.stake()).isEqualTo(UNIT));
            assertThat(published).isEmpty();
        }
    }

    // ==================== Two-step finalization ====================

    @Test
    void attesterFinalizesThenWinnerClaims() {
        long id = createAndFill();

        clock.set(END.minusSeconds(1));
        assertThatThrownBy(() -> ledger.finalizeChallenge(address(ATTESTER), id, carol, RESULT))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_IN_GRACE_PERIOD));

        clock.set(END.plus(Duration.ofDays(2)));
        assertThatThrownBy(() -> ledger.finalizeChallenge(alice, id, alice, RESULT))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_ATTESTER));
        assertThatThrownBy(() -> ledger.finalizeChallenge(address(ATTESTER), id, mallory, RESULT))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_PARTICIPANT));
        assertThatThrownBy(() -> ledger.finalizeChallenge(address(ATTESTER), id, carol, Hashes.EMPTY))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.EMPTY_RESULT_HASH));

        assertThatThrownBy(() -> ledger.claimPrize(id, carol))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_FINALIZED));

        ledger.finalizeChallenge(address(ATTESTER), id, carol, RESULT);
        assertThat(ledger.effectiveState(id)).isEqualTo(ChallengeState.FINALIZED);

        assertThatThrownBy(() -> ledger.claimWithAttestation(id, carol, attestNow(id, carol)))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.CHALLENGE_CLOSED));
        assertThatThrownBy(() -> ledger.claimPrize(id, alice))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_WINNER));

        assertThat(ledger.claimPrize(id, carol)).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
        assertThat(ledger.effectiveState(id)).isEqualTo(ChallengeState.COMPLETED);
        assertThatThrownBy(() -> ledger.claimPrize(id, carol))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.CHALLENGE_CLOSED));
        assertThat(payouts.totalPaidOut()).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
    }

    // ==================== Consent ====================

    @Nested
    class Consent {

        private List<String> cancelSignatures(long id, Credentials... signers) {
            List<String> signatures = new ArrayList<>();
            for (Credentials signer : signers) {
                signatures.add(EthereumSignatures.sign(ChallengeMessages.cancelDigest(id), signer));
            }
            return signatures;
        }

        @Test
        void unanimousConsentCancelsAndRefunds() {
            long id = createAndFill();
            clock.set(START.plus(Duration.ofDays(2)));

            ledger.cancelByConsent(id, cancelSignatures(id, CAROL, ALICE, BOB));

            assertThat(ledger.effectiveState(id)).isEqualTo(ChallengeState.CANCELLED);
            assertThat(ledger.withdrawFromCancelled(id, alice)).isEqualTo(UNIT);
            assertThat(ledger.withdrawFromCancelled(id, carol)).isEqualTo(UNIT);
            assertThat(ledger.getChallenge(id).totalStaked()).isEqualTo(UNIT);
            assertThat(events).filteredOn(LedgerEvent.ChallengeCancelled.class::isInstance).hasSize(1);

            assertThatThrownBy(() -> ledger.cancelByConsent(id, cancelSignatures(id, ALICE, BOB, CAROL)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.CANNOT_CANCEL));
        }

        @Test
        void consentCountsJoinedParticipantsNotWhitelist() {
            long id = createThreeWay();
            ledger.join(id, alice, "strava-1", UNIT);
            ledger.join(id, bob, "strava-2", UNIT);

            ledger.cancelByConsent(id, cancelSignatures(id, ALICE, BOB));

            assertThat(ledger.getChallenge(id).storedState()).isEqualTo(ChallengeState.CANCELLED);
        }

        @Test
        void incompleteOrTamperedConsentIsRejected() {
            long id = createAndFill();
            clock.set(END);

            assertThatThrownBy(() -> ledger.cancelByConsent(id, cancelSignatures(id, ALICE, BOB)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.WRONG_SIGNATURE_COUNT));
            assertThatThrownBy(() -> ledger.cancelByConsent(id, null))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.WRONG_SIGNATURE_COUNT));
            assertThatThrownBy(() -> ledger.cancelByConsent(id, cancelSignatures(id, ALICE, BOB, BOB)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.DUPLICATE_SIGNER));
            assertThatThrownBy(() -> ledger.cancelByConsent(id, cancelSignatures(id, ALICE, BOB, MALLORY)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_SIGNATURE));
            assertThatThrownBy(() -> ledger.cancelByConsent(id, cancelSignatures(id + 1, ALICE, BOB, CAROL)))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_SIGNATURE));

            List<String> withFinalize = cancelSignatures(id, ALICE, BOB);
            withFinalize.add(EthereumSignatures.sign(
                    ChallengeMessages.finalizeDigest(id, carol, RESULT, 1), CAROL));
            assertThatThrownBy(() -> ledger.cancelByConsent(id, withFinalize))
                    .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_SIGNATURE));

            assertThat(ledger.effectiveState(id)).isEqualTo(ChallengeState.GRACE_PERIOD);
            assertThat(events).filteredOn(LedgerEvent.ChallengeCancelled.class::isInstance).isEmpty();
        }
    }

    // ==================== Emergency ====================

    @Test
    void emergencyWithdrawalOpensAfterEmergencyPeriod() {
        long id = createAndFill();

        clock.set(END.plus(Duration.ofDays(14)).minusSeconds(1));
        assertThatThrownBy(() -> ledger.emergencyWithdraw(id, alice))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.EMERGENCY_PERIOD_NOT_REACHED));

        clock.set(END.plus(Duration.ofDays(14)));
        assertThat(ledger.emergencyWithdraw(id, alice)).isEqualTo(UNIT);
        assertThat(ledger.emergencyWithdraw(id, bob)).isEqualTo(UNIT);
        assertThat(ledger.emergencyWithdraw(id, carol)).isEqualTo(UNIT);
        assertThatThrownBy(() -> ledger.emergencyWithdraw(id, alice))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NO_STAKE_TO_WITHDRAW));

        assertThat(ledger.getChallenge(id).totalStaked()).isZero();
        assertThat(ledger.effectiveState(id)).isEqualTo(ChallengeState.GRACE_PERIOD);
        assertThat(events).filteredOn(LedgerEvent.EmergencyWithdrawal.class::isInstance).hasSize(3);
    }

    @Test
    void emergencyWithdrawalUnavailableAfterSettlement() {
        long id = createAndFill();
        clock.set(END);
        ledger.claimWithAttestation(id, alice, attestNow(id, alice));

        clock.set(END.plus(Duration.ofDays(20)));
        assertThatThrownBy(() -> ledger.emergencyWithdraw(id, bob))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.CHALLENGE_CLOSED));
    }

    // ==================== Attester key ====================

    @Test
    void onlyCurrentAttesterRotatesKey() {
        long id = createAndFill();
        clock.set(END);
        Attestation fromOldKey = attestNow(id, alice);

        assertThatThrownBy(() -> ledger.updateAttesterKey(alice, mallory))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.NOT_ATTESTER));
        assertThatThrownBy(() -> ledger.updateAttesterKey(address(ATTESTER), null))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.INVALID_PARAMETERS));

        assertThat(ledger.updateAttesterKey(address(ATTESTER), mallory)).isEqualTo(2);
        assertThat(ledger.attesterAddress()).isEqualTo(mallory);
        assertThat(ledger.attesterKeyVersion()).isEqualTo(2);

        assertThatThrownBy(() -> ledger.claimWithAttestation(id, alice, fromOldKey))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(LedgerError.SIGNER_NOT_ATTESTER));
        Attestation fromNewKey = attest(MALLORY, id, alice, RESULT, clock.instant().getEpochSecond());
        assertThat(ledger.claimWithAttestation(id, alice, fromNewKey)).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
    }

    @Test
    void failingListenerDoesNotAffectOperation() {
        ledger.addListener(event -> {
            throw new IllegalStateException("listener down");
        });

        long id = createThreeWay();
        ledger.join(id, alice, "strava-1", UNIT);

        assertThat(ledger.getChallenge(id).participantCount()).isEqualTo(1);
        assertThat(events).hasSize(2);
    }

    // ==================== Concurrency ====================

    @Nested
    class Concurrency {

        private static final int PLAYERS = 24;

        private List<String> players() {
            List<String> players = new ArrayList<>();
            for (int i = 1; i <= PLAYERS; i++) {
                players.add(String.format("0x%040x", 0xA000 + i));
            }
            return players;
        }

        private void runTogether(List<Runnable> tasks) throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
            CountDownLatch ready = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (Runnable task : tasks) {
                    futures.add(pool.submit(() -> {
                        ready.await();
                        task.run();
                        return null;
                    }));
                }
                ready.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void concurrentJoinsAccountForEveryStake() throws Exception {
            List<String> players = players();
            long id = ledger.createChallenge(alice, START, END, UNIT, players);
            List<Runnable> joins = new ArrayList<>();
            for (int i = 0; i < players.size(); i++) {
                String player = players.get(i);
                String correlationId = "strava-" + i;
                joins.add(() -> ledger.join(id, player, correlationId, UNIT));
            }

            runTogether(joins);

            ChallengeSnapshot challenge = ledger.getChallenge(id);
            assertThat(challenge.participantCount()).isEqualTo(PLAYERS);
            assertThat(challenge.totalStaked()).isEqualTo(UNIT.multiply(BigInteger.valueOf(PLAYERS)));
            assertThat(ledger.getParticipants(id))
                    .extracting(ParticipantSnapshot::joinOrder)
                    .containsExactlyInAnyOrderElementsOf(
                            IntStream.range(0, PLAYERS).boxed().collect(Collectors.toList()));
        }

        @Test
        void sameParticipantJoiningTwiceAtOnceIsCountedOnce() throws Exception {
            long id = createThreeWay();
            AtomicInteger rejected = new AtomicInteger();
            List<Runnable> joins = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                joins.add(() -> {
                    try {
                        ledger.join(id, bob, "strava-2", UNIT);
                    } catch (LedgerException e) {
                        assertThat(e.getError()).isEqualTo(LedgerError.ALREADY_JOINED);
                        rejected.incrementAndGet();
                    }
                });
            }

            runTogether(joins);

            assertThat(rejected).hasValue(7);
            assertThat(ledger.getChallenge(id).totalStaked()).isEqualTo(UNIT);
        }

        @Test
        void concurrentRefundsPayEachStakeOnce() throws Exception {
            long id = createAndFill();
            clock.set(END.plus(Duration.ofDays(14)));
            List<Runnable> withdrawals = new ArrayList<>();
            for (String player : List.of(alice, bob, carol, alice, bob, carol)) {
                withdrawals.add(() -> {
                    try {
                        ledger.emergencyWithdraw(id, player);
                    } catch (LedgerException e) {
                        assertThat(e.getError()).isEqualTo(LedgerError.NO_STAKE_TO_WITHDRAW);
                    }
                });
            }

            runTogether(withdrawals);

            assertThat(payouts.totalPaidOut()).isEqualTo(UNIT.multiply(BigInteger.valueOf(3)));
            assertThat(ledger.getChallenge(id).totalStaked()).isZero();
        }
    }
}
