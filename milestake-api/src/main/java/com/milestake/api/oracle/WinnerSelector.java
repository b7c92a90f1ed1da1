package com.milestake.api.oracle;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the participant with the most miles. Ties go to whoever joined first.
 */
public final class WinnerSelector {

    static final Comparator<ParticipantStanding> RANKING = Comparator
            .comparing(ParticipantStanding::miles, Comparator.reverseOrder())
            .thenComparingInt(ParticipantStanding::joinOrder);

    private WinnerSelector() {}

    public static ParticipantStanding select(List<ParticipantStanding> standings) {
        return standings.stream()
                .min(RANKING)
                .orElseThrow(() -> new IllegalArgumentException("No participants to rank"));
    }

    /**
     * @return standings ordered as a leaderboard, best first
     */
    public static List<ParticipantStanding> rank(List<ParticipantStanding> standings) {
        return standings.stream().sorted(RANKING).toList();
    }
}
