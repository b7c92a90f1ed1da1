package com.milestake.api.oracle;

import com.milestake.api.config.OracleProperties;
import com.milestake.core.domain.FinalizationDecision.Trigger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a challenge may be finalized.
 *
 * <p>A challenge is eligible once it has ended and either every participant has
 * confirmed their mileage or the grace period after the end has fully elapsed.
 * When both hold, the grace period is reported as the trigger.
 */
@Component
public class FinalizationPolicy {

    public static final String NO_PARTICIPANTS = "NO_PARTICIPANTS";
    public static final String NOT_ENDED = "CHALLENGE_NOT_ENDED";
    public static final String AWAITING_CONFIRMATIONS = "AWAITING_CONFIRMATIONS";

    private final Duration gracePeriod;

    @Autowired
    public FinalizationPolicy(OracleProperties properties) {
        this(properties.getGracePeriod());
    }

    public FinalizationPolicy(Duration gracePeriod) {
        if (gracePeriod == null || gracePeriod.isNegative()) {
            throw new IllegalArgumentException("Grace period must not be negative");
        }
        this.gracePeriod = gracePeriod;
    }

    public Eligibility evaluate(Instant now, Instant endTime, int confirmedCount, int totalParticipants) {
        if (totalParticipants == 0) {
            return Eligibility.refused(NO_PARTICIPANTS, 0, confirmedCount, totalParticipants);
        }
        if (now.isBefore(endTime)) {
            return Eligibility.refused(NOT_ENDED, Duration.between(now, endTime).toSeconds(),
                    confirmedCount, totalParticipants);
        }

        if (confirmedCount >= totalParticipants) {
            return Eligibility.granted(Trigger.ALL_CONFIRMED, confirmedCount, totalParticipants);
        }
        Instant graceEnd = endTime.plus(gracePeriod);
        if (!now.isBefore(graceEnd)) {
            return Eligibility.granted(Trigger.GRACE_PERIOD_EXPIRED, confirmedCount, totalParticipants);
        }
        return Eligibility.refused(AWAITING_CONFIRMATIONS, Duration.between(now, graceEnd).toSeconds(),
                confirmedCount, totalParticipants);
    }

    public Duration gracePeriod() {
        return gracePeriod;
    }

    /**
     * @param trigger              set when eligible
     * @param reason               set when refused
     * @param secondsUntilEligible time until the grace rule alone would allow finalization
     */
    public record Eligibility(
            boolean eligible,
            Trigger trigger,
            String reason,
            long secondsUntilEligible,
            int confirmedCount,
            int totalParticipants
    ) {
        static Eligibility granted(Trigger trigger, int confirmedCount, int totalParticipants) {
            return new Eligibility(true, trigger, null, 0, confirmedCount, totalParticipants);
        }

        static Eligibility refused(String reason, long secondsUntilEligible, int confirmedCount,
                                   int totalParticipants) {
            return new Eligibility(false, null, reason, secondsUntilEligible, confirmedCount, totalParticipants);
        }
    }
}
