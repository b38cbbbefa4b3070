package com.jolly.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jolly.game.Player;

import java.util.List;

/**
 * Aggregate statistics over a batch of simulated matches.
 */
public record SimulationSummary(
    @JsonProperty("matches") int matches,
    @JsonProperty("wins_one") int winsOne,
    @JsonProperty("wins_two") int winsTwo,
    @JsonProperty("draws") int draws,
    @JsonProperty("avg_rounds") double avgRounds,
    @JsonProperty("avg_turns_per_round") double avgTurnsPerRound,
    @JsonProperty("avg_score_one") double avgScoreOne,
    @JsonProperty("avg_score_two") double avgScoreTwo,

    /**
     * Rounds ended by a player turning down their last card, as opposed to running out of cards or turns.
     */
    @JsonProperty("ended_rounds") int endedRounds,
    @JsonProperty("exhausted_rounds") int exhaustedRounds
) {
    public static SimulationSummary of(List<MatchResult> results) {
        int matches = results.size();
        int winsOne = 0;
        int winsTwo = 0;
        int rounds = 0;
        int turns = 0;
        long scoreOne = 0;
        long scoreTwo = 0;
        int ended = 0;
        int exhausted = 0;

        for (MatchResult result : results) {
            if (result.winner() == Player.ONE) {
                winsOne++;
            } else if (result.winner() == Player.TWO) {
                winsTwo++;
            }
            scoreOne += result.score(Player.ONE);
            scoreTwo += result.score(Player.TWO);
            for (RoundResult round : result.rounds()) {
                rounds++;
                turns += round.turns();
                if (round.isExhausted()) {
                    exhausted++;
                } else {
                    ended++;
                }
            }
        }

        return new SimulationSummary(
                matches,
                winsOne,
                winsTwo,
                matches - winsOne - winsTwo,
                matches == 0 ? 0.0 : (double) rounds / matches,
                rounds == 0 ? 0.0 : (double) turns / rounds,
                matches == 0 ? 0.0 : (double) scoreOne / matches,
                matches == 0 ? 0.0 : (double) scoreTwo / matches,
                ended,
                exhausted);
    }

    public double winRateOne() {
        return matches == 0 ? 0.0 : (double) winsOne / matches;
    }

    public double winRateTwo() {
        return matches == 0 ? 0.0 : (double) winsTwo / matches;
    }
}
