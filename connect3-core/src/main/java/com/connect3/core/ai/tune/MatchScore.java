package com.connect3.core.ai.tune;

/**
 * Tally of one champion-versus-challenger match.
 */
public record MatchScore(int challengerWins, int championWins, int draws) {

    public MatchScore {
        if (challengerWins < 0 || championWins < 0 || draws < 0) {
            throw new IllegalArgumentException("Match tallies must not be negative");
        }
    }

    /**
     * Returns {@code true} if the challenger won more games than it lost. Drawn and tied matches
     * keep the champion.
     */
    public boolean challengerWonOutright() {
        return challengerWins > championWins;
    }

    public int games() {
        return challengerWins + championWins + draws;
    }
}
