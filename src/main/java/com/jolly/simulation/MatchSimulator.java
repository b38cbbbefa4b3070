package com.jolly.simulation;

import com.jolly.ai.AIStrategy;
import com.jolly.ai.Difficulty;
import com.jolly.ai.Pacer;
import com.jolly.config.JollyConfig;
import com.jolly.game.Player;
import com.jolly.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Plays AI-versus-AI matches without pauses. A match is fully determined by its seed.
 */
public final class MatchSimulator {
    private static final Logger log = LoggerFactory.getLogger(MatchSimulator.class);

    private MatchSimulator() {
        // Utility class - no instantiation
    }

    /**
     * Play a match: rounds alternate the starting player, starting with {@link Player#ONE},
     * until a score reaches the win threshold or the round limit is hit.
     *
     * @param one     profile for seat ONE
     * @param two     profile for seat TWO
     * @param verbose print a turn-by-turn trace to stdout
     */
    public static MatchResult runMatch(JollyConfig config, Difficulty one, Difficulty two,
                                       long seed, boolean verbose) {
        GameRng rng = new GameRng(seed);
        AIStrategy seatOne = new AIStrategy(Player.ONE, one, rng.fork(), Pacer.NONE, config.getFirstMeldMinPoints());
        AIStrategy seatTwo = new AIStrategy(Player.TWO, two, rng.fork(), Pacer.NONE, config.getFirstMeldMinPoints());

        Map<Player, Integer> scores = new EnumMap<>(Player.class);
        scores.put(Player.ONE, 0);
        scores.put(Player.TWO, 0);
        List<RoundResult> rounds = new ArrayList<>();

        if (verbose) {
            System.out.println("=== MATCH === seed " + seed + ": " + one.name() + " vs " + two.name());
        }

        Player starter = Player.ONE;
        while (rounds.size() < config.getMaxRounds() && !thresholdReached(scores, config)) {
            Round round = new Round(config, seatOne, seatTwo, rng.fork(), rounds.size() + 1, starter, verbose);
            RoundResult result = round.play();
            rounds.add(result);
            for (Player player : Player.values()) {
                scores.merge(player, result.scoreChange(player), Integer::sum);
            }
            if (verbose) {
                System.out.println("  Scores: ONE " + scores.get(Player.ONE) + ", TWO " + scores.get(Player.TWO));
            }
            starter = starter.opponent();
        }

        Player winner = winner(scores);
        if (log.isDebugEnabled()) {
            log.debug("Match seed {} finished after {} rounds: {} (winner {})", seed, rounds.size(), scores, winner);
        }
        if (verbose) {
            System.out.println("\n=== RESULT === " + (winner == null ? "draw" : winner + " wins")
                    + " after " + rounds.size() + " rounds");
        }
        return new MatchResult(seed, rounds, scores, winner);
    }

    private static boolean thresholdReached(Map<Player, Integer> scores, JollyConfig config) {
        return scores.values().stream().anyMatch(score -> score >= config.getWinThreshold());
    }

    /**
     * Lower score wins; equal scores are a draw.
     */
    static Player winner(Map<Player, Integer> scores) {
        int one = scores.get(Player.ONE);
        int two = scores.get(Player.TWO);
        if (one == two) {
            return null;
        }
        return one < two ? Player.ONE : Player.TWO;
    }
}
