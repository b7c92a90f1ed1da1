package com.milestake.api.oracle;

import com.milestake.api.oracle.FinalizationService.FinalizationResult;
import com.milestake.api.support.JpaSliceConfig;
import com.milestake.api.support.OracleFixture;
import com.milestake.blockchain.contract.Attestation;
import com.milestake.core.domain.FinalizationDecision.Trigger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ContextConfiguration;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

import static com.milestake.api.support.OracleFixture.*;
import static com.milestake.api.support.Wallets.*;
import static org.assertj.core.api.Assertions.*;

/**
 * A fresh ledger numbers challenges from 0 again while the database keeps
 * everything its predecessor recorded.
 */
@DataJpaTest
@ContextConfiguration(classes = {JpaSliceConfig.class, OracleFixture.Repositories.class})
class LedgerRestartTest {

    @Autowired
    private OracleFixture.Repositories repositories;

    private static FinalizationResult settle(OracleFixture fx, long id, String alice, String bob) {
        fx.clock.set(START.plus(Duration.ofDays(1)));
        fx.mockConnector.setMileage(address(ALICE), new BigDecimal(alice));
        fx.mockConnector.setMileage(address(BOB), new BigDecimal(bob));
        fx.sync.syncChallenge(id);
        fx.clock.set(END.plus(Duration.ofDays(7)));
        return (FinalizationResult) fx.finalization.requestFinalization(id);
    }

    @Test
    void newLedgerDoesNotInheritItsPredecessorsDecision() {
        OracleFixture first = OracleFixture.create(repositories);
        long firstId = first.challengeJoinedBy(ALICE, BOB);
        first.clock.set(END);
        first.confirmations.confirm(firstId, address(ALICE), confirmation(firstId, ALICE));
        first.confirmations.confirm(firstId, address(BOB), confirmation(firstId, BOB));
        FinalizationResult before = settle(first, firstId, "1.00", "30.00");
        assertThat(before.winner().address()).isEqualTo(address(BOB));

        OracleFixture second = OracleFixture.create(repositories);
        long id = second.challengeJoinedBy(ALICE, BOB);
        assertThat(id).isEqualTo(firstId);
        second.clock.set(END);
        var confirmed = second.confirmations.confirm(id, address(ALICE), confirmation(id, ALICE));
        assertThat(confirmed.confirmedCount()).isEqualTo(1);

        FinalizationResult after = settle(second, id, "50.00", "2.00");

        assertThat(after.winner().address()).isEqualTo(address(ALICE));
        assertThat(after.winner().miles()).isEqualByComparingTo("50.00");
        assertThat(after.trigger()).isEqualTo(Trigger.GRACE_PERIOD_EXPIRED);
        assertThat(after.confirmedCount()).isEqualTo(1);
        assertThat(after.resultHash()).isNotEqualTo(before.resultHash());

        Attestation attestation = new Attestation(id, after.winner().address(), after.resultHash(),
                after.signingTimestamp(), after.signature());
        assertThat(second.ledger.claimWithAttestation(id, address(ALICE), attestation))
                .isEqualTo(STAKE.multiply(BigInteger.TWO));
        assertThat(second.payouts.receivedBy(address(BOB))).isZero();

        assertThat(repositories.decisions.countByLedgerIdAndChallengeId(first.ledger.ledgerId(), id)).isEqualTo(1);
        assertThat(repositories.decisions.countByLedgerIdAndChallengeId(second.ledger.ledgerId(), id)).isEqualTo(1);
        assertThat(repositories.summaries.findByLedgerIdOrderByChallengeIdDesc(second.ledger.ledgerId()))
                .singleElement()
                .satisfies(summary -> assertThat(summary.getWinner()).isEqualTo(address(ALICE)));
    }

    @Test
    void reusedLedgerIdWithDifferentParticipantsIsNotSigned() {
        OracleFixture first = OracleFixture.onLedger(repositories, "ledger-reused");
        long id = first.challengeJoinedBy(ALICE, BOB);
        assertThat(settle(first, id, "1.00", "30.00").winner().address()).isEqualTo(address(BOB));

        OracleFixture second = OracleFixture.onLedger(repositories, "ledger-reused");
        assertThat(second.challengeJoinedBy(ALICE, CAROL)).isEqualTo(id);
        second.clock.set(END.plus(Duration.ofDays(7)));

        assertThatThrownBy(() -> second.finalization.requestFinalization(id))
                .isInstanceOf(FinalizationService.DecisionMismatchException.class)
                .hasMessageContaining("participants differ");
    }
}
