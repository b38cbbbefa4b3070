package com.jolly.simulation;

import com.jolly.ai.Difficulty;
import com.jolly.config.JollyConfig;
import com.jolly.config.JollyConfigException;
import com.jolly.game.Player;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MatchSimulator and SimulationSummary.
 */
class MatchSimulatorTest {

    private JollyConfig config;

    @BeforeEach
    void setUp() throws JollyConfigException {
        config = JollyConfig.fromResource("quick-match.json");
    }

    @Test
    void testSameSeedSameMatch() {
        MatchResult first = MatchSimulator.runMatch(config, Difficulty.EASY, Difficulty.HARD, 42, false);
        MatchResult second = MatchSimulator.runMatch(config, Difficulty.EASY, Difficulty.HARD, 42, false);

        assertEquals(first, second);
    }

    @Test
    void testMatchTerminates() {
        for (long seed = 1; seed <= 10; seed++) {
            MatchResult result = MatchSimulator.runMatch(config, Difficulty.MEDIUM, Difficulty.MEDIUM, seed, false);

            assertEquals(seed, result.seed());
            assertFalse(result.rounds().isEmpty());
            boolean reachedThreshold = result.score(Player.ONE) >= config.getWinThreshold()
                    || result.score(Player.TWO) >= config.getWinThreshold();
            assertTrue(reachedThreshold || result.rounds().size() == config.getMaxRounds(),
                    "Seed " + seed + " stopped early");
        }
    }

    @Test
    void testScoresAreSumOfRounds() {
        MatchResult result = MatchSimulator.runMatch(config, Difficulty.HARD, Difficulty.EASY, 9, false);

        for (Player player : Player.values()) {
            int sum = result.rounds().stream().mapToInt(r -> r.scoreChange(player)).sum();
            assertEquals(sum, result.score(player));
        }
        for (int i = 0; i < result.rounds().size(); i++) {
            assertEquals(i + 1, result.rounds().get(i).round());
        }
    }

    @Test
    void testLowerScoreWins() {
        MatchResult result = MatchSimulator.runMatch(config, Difficulty.HARD, Difficulty.EASY, 3, false);

        if (result.isDraw()) {
            assertEquals(result.score(Player.ONE), result.score(Player.TWO));
        } else {
            Player loser = result.winner().opponent();
            assertTrue(result.score(result.winner()) < result.score(loser));
        }
    }

    @Test
    void testVerboseTraceDoesNotChangeResult() {
        MatchResult quiet = MatchSimulator.runMatch(config, Difficulty.MEDIUM, Difficulty.HARD, 21, false);
        MatchResult traced = MatchSimulator.runMatch(config, Difficulty.MEDIUM, Difficulty.HARD, 21, true);

        assertEquals(quiet, traced);
    }

    @Test
    void testWinner() {
        Map<Player, Integer> scores = new EnumMap<>(Player.class);
        scores.put(Player.ONE, 120);
        scores.put(Player.TWO, 90);
        assertEquals(Player.TWO, MatchSimulator.winner(scores));

        scores.put(Player.TWO, 120);
        assertNull(MatchSimulator.winner(scores));
    }

    @Test
    void testSingleRoundMatch() throws JollyConfigException {
        JollyConfig oneRound = JollyConfig.fromJson("{\"max_rounds\": 1}");

        MatchResult result = MatchSimulator.runMatch(oneRound, Difficulty.MEDIUM, Difficulty.MEDIUM, 8, false);

        assertEquals(1, result.rounds().size());
        assertEquals(result.rounds().get(0).turns(), result.totalTurns());
    }

    @Test
    void testSummary() {
        List<MatchResult> results = new ArrayList<>();
        for (long seed = 100; seed < 105; seed++) {
            results.add(MatchSimulator.runMatch(config, Difficulty.HARD, Difficulty.EASY, seed, false));
        }

        SimulationSummary summary = SimulationSummary.of(results);

        assertEquals(5, summary.matches());
        assertEquals(5, summary.winsOne() + summary.winsTwo() + summary.draws());
        int rounds = results.stream().mapToInt(r -> r.rounds().size()).sum();
        assertEquals(rounds, summary.endedRounds() + summary.exhaustedRounds());
        assertEquals((double) rounds / 5, summary.avgRounds(), 1e-9);
        assertTrue(summary.avgTurnsPerRound() > 0);
    }

    @Test
    void testEmptySummary() {
        SimulationSummary summary = SimulationSummary.of(List.of());

        assertEquals(0, summary.matches());
        assertEquals(0.0, summary.avgRounds());
        assertEquals(0.0, summary.winRateOne());
    }
}
