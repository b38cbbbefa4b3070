package com.jolly;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jolly.ai.Difficulty;
import com.jolly.card.Card;
import com.jolly.card.CardNotation;
import com.jolly.card.CardNotationException;
import com.jolly.config.JollyConfig;
import com.jolly.config.JollyConfigException;
import com.jolly.game.Meld;
import com.jolly.game.MeldKind;
import com.jolly.rules.RulesEngine;
import com.jolly.simulation.MatchResult;
import com.jolly.simulation.MatchSimulator;
import com.jolly.simulation.SimulationSummary;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;

/**
 * Jolly CLI - Main entry point.
 */
@Command(name = "jolly",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Jolly rummy rules engine and AI simulator",
        subcommands = {
                Main.SimulateCommand.class,
                Main.AnalyzeCommand.class,
                Main.CheckCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Run AI-versus-AI matches")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-games"}, defaultValue = "100",
                description = "Number of matches to simulate")
        int numGames;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (first match trace)")
        boolean verbose;

        @Option(names = {"--p1"}, defaultValue = "medium",
                description = "Difficulty of player ONE: easy, medium or hard")
        String p1;

        @Option(names = {"--p2"}, defaultValue = "medium",
                description = "Difficulty of player TWO: easy, medium or hard")
        String p2;

        @Option(names = {"-c", "--config"},
                description = "Path to a JSON configuration file (default: bundled jolly.json)")
        String configPath;

        @Option(names = {"--json"},
                description = "Print the summary as JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            if (numGames < 1) {
                System.err.println("✗ Number of games must be positive: " + numGames);
                return 1;
            }

            JollyConfig config;
            Difficulty one;
            Difficulty two;
            try {
                config = configPath == null ? JollyConfig.defaults() : JollyConfig.fromFile(configPath);
                one = config.getDifficulty(p1);
                two = config.getDifficulty(p2);
            } catch (JollyConfigException e) {
                System.err.println("✗ Failed to load configuration: " + e.getMessage());
                return 1;
            }
            if (configPath != null) {
                System.err.println("✓ Loaded configuration from " + configPath);
            }

            if (!json) {
                System.out.println("\n=== Jolly Simulator ===\n");
                System.out.println("Player ONE: " + one.name());
                System.out.println("Player TWO: " + two.name());
                System.out.println("Matches: " + numGames + " (to " + config.getWinThreshold() + " points)");
                if (seed != null) {
                    System.out.println("Seed: " + seed);
                }
                System.out.println();
            }

            long startTime = System.currentTimeMillis();
            List<MatchResult> results = runSimulations(config, one, two, numGames, seed, verbose && !json);
            long elapsed = System.currentTimeMillis() - startTime;

            SimulationSummary summary = SimulationSummary.of(results);
            if (json) {
                ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                System.out.println(mapper.writeValueAsString(summary));
            } else {
                printResults(summary, results, elapsed);
            }
            return 0;
        }
    }

    // ========== ANALYZE COMMAND ==========
    @Command(name = "analyze", description = "Find melds in a hand and suggest a discard")
    static class AnalyzeCommand implements Callable<Integer> {
        @Parameters(arity = "1..*", description = "Cards, e.g. 7S 8S 9S JK QH")
        List<String> cards;

        @Option(names = {"--threshold"}, defaultValue = "30",
                description = "First-meld minimum points")
        int threshold;

        @Override
        public Integer call() {
            List<Card> hand;
            try {
                hand = parseCards(cards);
            } catch (CardNotationException e) {
                System.err.println("✗ Invalid card: " + e.getMessage());
                return 1;
            }
            if (hand.isEmpty()) {
                System.err.println("✗ No cards given");
                return 1;
            }

            System.out.println("\n=== Hand Analysis ===\n");
            System.out.println("Hand (" + hand.size() + " cards): " + format(hand));
            System.out.println();

            List<Meld> melds = RulesEngine.findMelds(hand);
            if (melds.isEmpty()) {
                System.out.println("No melds found.");
            } else {
                System.out.println("Melds:");
                for (Meld meld : melds) {
                    System.out.printf("  %-40s %3d points%s%n", meld, RulesEngine.calculateMeldPoints(meld),
                            meld.isPure() ? " (pure)" : "");
                }
            }

            int meldPoints = RulesEngine.calculateTotalMeldPoints(melds);
            List<Card> unmatched = RulesEngine.unmatchedCards(hand, melds);
            System.out.println();
            System.out.printf("Meld points: %d (first meld %s, needs %d)%n", meldPoints,
                    RulesEngine.meetsFirstMeldRequirement(melds, threshold) ? "allowed" : "not allowed", threshold);
            System.out.println("Unmatched: " + format(unmatched));
            System.out.println("Hand penalty: " + RulesEngine.calculateHandPoints(hand));
            System.out.println("Unmatched penalty: " + RulesEngine.calculateHandPoints(unmatched));
            System.out.println("Suggested discard: " + RulesEngine.suggestDiscard(hand));
            return 0;
        }
    }

    // ========== CHECK COMMAND ==========
    @Command(name = "check", description = "Check whether a group of cards forms a meld")
    static class CheckCommand implements Callable<Integer> {
        @Parameters(arity = "1..*", description = "Cards of the group, e.g. QS QH QD JK")
        List<String> cards;

        @Override
        public Integer call() {
            List<Card> group;
            try {
                group = parseCards(cards);
            } catch (CardNotationException e) {
                System.err.println("✗ Invalid card: " + e.getMessage());
                return 1;
            }
            if (group.isEmpty()) {
                System.err.println("✗ No cards given");
                return 1;
            }

            boolean set = RulesEngine.isValidSet(group);
            boolean sequence = RulesEngine.isValidSequence(group);

            System.out.println("\n=== Meld Check ===\n");
            System.out.println("Cards: " + format(group));
            System.out.println("Valid set: " + yesNo(set));
            System.out.println("Valid sequence: " + yesNo(sequence));
            if (sequence) {
                System.out.println("Pure sequence: " + yesNo(RulesEngine.isPureSequence(group)));
                System.out.println("High-ace sequence: " + yesNo(RulesEngine.isHighAceSequence(group)));
            }
            if (set || sequence) {
                Meld meld = new Meld(set ? MeldKind.SET : MeldKind.SEQUENCE, group);
                System.out.println("Meld points: " + RulesEngine.calculateMeldPoints(meld));
            }
            return 0;
        }
    }

    // ========== HELPER FUNCTIONS ==========

    private static List<MatchResult> runSimulations(JollyConfig config, Difficulty one, Difficulty two,
                                                    int count, Long seed, boolean verbose) {
        if (seed != null) {
            // Sequential with fixed seed
            List<MatchResult> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                boolean verboseThisMatch = verbose && i == 0;
                results.add(MatchSimulator.runMatch(config, one, two, seed + i, verboseThisMatch));
            }
            return results;
        } else if (verbose) {
            // Sequential for verbose mode
            long baseSeed = System.nanoTime();
            System.out.println("Seed: " + baseSeed);
            List<MatchResult> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                results.add(MatchSimulator.runMatch(config, one, two, baseSeed + i, i == 0));
            }
            return results;
        } else {
            // Parallel with random seeds
            return IntStream.range(0, count)
                    .parallel()
                    .mapToObj(i -> MatchSimulator.runMatch(config, one, two, System.nanoTime() + i, false))
                    .toList();
        }
    }

    private static void printResults(SimulationSummary summary, List<MatchResult> results, long elapsedMs) {
        System.out.println("=== Results ===\n");
        System.out.printf("Player ONE wins: %5.1f%% (%d/%d)%n",
                summary.winRateOne() * 100.0, summary.winsOne(), summary.matches());
        System.out.printf("Player TWO wins: %5.1f%% (%d/%d)%n",
                summary.winRateTwo() * 100.0, summary.winsTwo(), summary.matches());
        if (summary.draws() > 0) {
            System.out.printf("Draws: %d%n", summary.draws());
        }
        System.out.println();
        System.out.printf("Average rounds per match: %.2f%n", summary.avgRounds());
        System.out.printf("Average turns per round: %.2f%n", summary.avgTurnsPerRound());
        System.out.printf("Average final score: ONE %.1f, TWO %.1f%n", summary.avgScoreOne(), summary.avgScoreTwo());
        System.out.printf("Rounds ended by a player: %d, ran out: %d%n",
                summary.endedRounds(), summary.exhaustedRounds());
        System.out.println();

        // Rounds-per-match distribution
        Map<Integer, Long> roundDist = new TreeMap<>();
        for (MatchResult r : results) {
            roundDist.merge(r.rounds().size(), 1L, Long::sum);
        }
        System.out.println("Rounds distribution:");
        for (Map.Entry<Integer, Long> entry : roundDist.entrySet()) {
            double pct = (double) entry.getValue() / summary.matches() * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  %2d rounds: %5.1f%% %s (%d)%n", entry.getKey(), pct, bar, entry.getValue());
        }

        System.out.println();
        System.out.printf("Completed in %.2fs%n", elapsedMs / 1000.0);
    }

    private static List<Card> parseCards(List<String> tokens) throws CardNotationException {
        List<String> split = new ArrayList<>();
        for (String token : tokens) {
            for (String part : token.trim().split("[\\s,]+")) {
                if (!part.isEmpty()) {
                    split.add(part);
                }
            }
        }
        return CardNotation.parseAll(split);
    }

    private static String format(List<Card> cards) {
        if (cards.isEmpty()) {
            return "-";
        }
        StringBuilder sb = new StringBuilder();
        for (Card card : cards) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(card.notation());
        }
        return sb.toString();
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }
}
