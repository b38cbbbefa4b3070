package com.jolly.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jolly.game.Player;

import java.util.Map;

/**
 * Result of a single simulated round.
 */
public record RoundResult(
    @JsonProperty("round") int round,

    /**
     * Player who ended the round (zudrehen), null if the round ran out of cards or turns.
     */
    @JsonProperty("ender") Player ender,

    /**
     * Score change per player: penalty points for cards left in hand, minus the bonus for the ender.
     */
    @JsonProperty("score_changes") Map<Player, Integer> scoreChanges,

    @JsonProperty("turns") int turns
) {
    public RoundResult {
        scoreChanges = Map.copyOf(scoreChanges);
    }

    public boolean isExhausted() {
        return ender == null;
    }

    public int scoreChange(Player player) {
        return scoreChanges.getOrDefault(player, 0);
    }
}
