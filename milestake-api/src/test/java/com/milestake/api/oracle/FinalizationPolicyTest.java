package com.milestake.api.oracle;

import com.milestake.core.domain.FinalizationDecision.Trigger;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class FinalizationPolicyTest {

    private static final Instant END = Instant.parse("2026-05-01T00:00:00Z");
    private static final Duration GRACE = Duration.ofDays(7);

    private final FinalizationPolicy policy = new FinalizationPolicy(GRACE);

    @Test
    void refusesBeforeEndEvenWhenEveryoneConfirmed() {
        var result = policy.evaluate(END.minusSeconds(90), END, 3, 3);

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo(FinalizationPolicy.NOT_ENDED);
        assertThat(result.secondsUntilEligible()).isEqualTo(90);
    }

    @Test
    void allConfirmedAllowsFinalizationAtEnd() {
        var result = policy.evaluate(END, END, 3, 3);

        assertThat(result.eligible()).isTrue();
        assertThat(result.trigger()).isEqualTo(Trigger.ALL_CONFIRMED);
    }

    @Test
    void waitsForConfirmationsDuringGrace() {
        var result = policy.evaluate(END.plus(Duration.ofDays(2)), END, 1, 3);

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo(FinalizationPolicy.AWAITING_CONFIRMATIONS);
        assertThat(result.secondsUntilEligible()).isEqualTo(Duration.ofDays(5).toSeconds());
        assertThat(result.confirmedCount()).isEqualTo(1);
        assertThat(result.totalParticipants()).isEqualTo(3);
    }

    @Test
    void graceBoundaryIsInclusive() {
        assertThat(policy.evaluate(END.plus(GRACE).minusSeconds(1), END, 0, 2).eligible()).isFalse();

        var result = policy.evaluate(END.plus(GRACE), END, 0, 2);
        assertThat(result.eligible()).isTrue();
        assertThat(result.trigger()).isEqualTo(Trigger.GRACE_PERIOD_EXPIRED);
    }

    @Test
    void unanimousConfirmationIsReportedEvenAfterGrace() {
        var result = policy.evaluate(END.plus(GRACE).plus(Duration.ofDays(1)), END, 2, 2);

        assertThat(result.eligible()).isTrue();
        assertThat(result.trigger()).isEqualTo(Trigger.ALL_CONFIRMED);
    }

    @Test
    void nothingToFinalizeWithoutParticipants() {
        var result = policy.evaluate(END.plus(GRACE), END, 0, 0);

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo(FinalizationPolicy.NO_PARTICIPANTS);
    }

    @Test
    void rejectsNegativeGracePeriod() {
        assertThatThrownBy(() -> new FinalizationPolicy(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Property(tries = 300)
    void eligibilityMatchesDecisionRule(
            @ForAll @LongRange(min = -864_000, max = 1_728_000) long secondsAfterEnd,
            @ForAll @IntRange(min = 1, max = 20) int total,
            @ForAll @IntRange(min = 0, max = 20) int confirmedRaw) {
        // Property: eligible exactly when ended and (grace elapsed or everyone confirmed)
        int confirmed = Math.min(confirmedRaw, total);
        Instant now = END.plusSeconds(secondsAfterEnd);

        var result = policy.evaluate(now, END, confirmed, total);

        boolean expected = secondsAfterEnd >= 0
                && (secondsAfterEnd >= GRACE.toSeconds() || confirmed == total);
        assertThat(result.eligible()).isEqualTo(expected);
        if (!expected) {
            assertThat(result.secondsUntilEligible()).isPositive();
            assertThat(result.trigger()).isNull();
        } else {
            assertThat(result.trigger())
                    .isEqualTo(confirmed == total ? Trigger.ALL_CONFIRMED : Trigger.GRACE_PERIOD_EXPIRED);
        }
    }
}
