package com.jolly.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jolly.game.Player;

import java.util.List;
import java.util.Map;

/**
 * Result of a simulated match: rounds are played until a score reaches the win threshold,
 * and the lower score wins.
 */
public record MatchResult(
    @JsonProperty("seed") long seed,
    @JsonProperty("rounds") List<RoundResult> rounds,
    @JsonProperty("scores") Map<Player, Integer> scores,

    /**
     * Player with the lower final score, null on a tie.
     */
    @JsonProperty("winner") Player winner
) {
    public MatchResult {
        rounds = List.copyOf(rounds);
        scores = Map.copyOf(scores);
    }

    public boolean isDraw() {
        return winner == null;
    }

    public int score(Player player) {
        return scores.getOrDefault(player, 0);
    }

    public int totalTurns() {
        return rounds.stream().mapToInt(RoundResult::turns).sum();
    }
}
