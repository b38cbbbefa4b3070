package com.jolly.rules;

import com.jolly.card.Card;
import com.jolly.card.Rank;
import com.jolly.card.Suit;
import com.jolly.game.Meld;
import com.jolly.game.MeldKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Greedy meld discovery without subset enumeration.
 *
 * Each round builds the best set candidate from rank groups and the best sequence
 * candidate from a two-pointer scan over each suit's sorted values (Ace low and Ace high),
 * both topped up with the unclaimed jokers. The winner is claimed and the search repeats
 * on what is left. Taking the largest candidate each round, sequences first on equal size
 * and earliest hand positions after that, gives the same result as walking every
 * combination by descending size, at O(n log n) per accepted meld.
 */
final class MeldFinder {

    private static final Comparator<Candidate> PRIORITY = Comparator
            .comparingInt(Candidate::size).reversed()
            .thenComparing(c -> c.kind() == MeldKind.SEQUENCE ? 0 : 1)
            .thenComparing(Candidate::positions, MeldFinder::compareLexicographic);

    private MeldFinder() {
        // Utility class - no instantiation
    }

    static List<Meld> find(List<Card> hand) {
        Map<Card, Integer> positions = new HashMap<>();
        Set<Card> available = new LinkedHashSet<>();
        for (int i = 0; i < hand.size(); i++) {
            Card card = hand.get(i);
            if (available.add(card)) {
                positions.put(card, i);
            }
        }

        List<Meld> melds = new ArrayList<>();
        while (true) {
            List<Card> jokers = new ArrayList<>();
            List<Card> naturals = new ArrayList<>();
            for (Card card : available) {
                if (card.isJoker()) {
                    jokers.add(card);
                } else {
                    naturals.add(card);
                }
            }

            Candidate sequence = bestSequence(naturals, jokers, positions);
            Candidate set = bestSet(naturals, jokers, positions);
            Candidate best = sequence;
            if (set != null && (best == null || PRIORITY.compare(set, best) < 0)) {
                best = set;
            }
            if (best == null) {
                return melds;
            }
            melds.add(new Meld(best.kind(), best.cards()));
            best.cards().forEach(available::remove);
        }
    }

    // ==================== SETS ====================

    private static Candidate bestSet(List<Card> naturals, List<Card> jokers, Map<Card, Integer> positions) {
        Map<Rank, List<Card>> byRank = new EnumMap<>(Rank.class);
        for (Card card : naturals) {
            byRank.computeIfAbsent(card.getRank(), r -> new ArrayList<>()).add(card);
        }

        Candidate best = null;
        for (List<Card> group : byRank.values()) {
            int size = Math.min(RulesEngine.MAX_SET_SIZE, group.size() + jokers.size());
            if (size < RulesEngine.MIN_SET_SIZE) {
                continue;
            }
            // Earliest cards of the group and the jokers, with at least one natural
            List<Card> pool = new ArrayList<>(group);
            pool.addAll(jokers);
            pool.sort(Comparator.comparingInt(positions::get));
            List<Card> chosen = new ArrayList<>(pool.subList(0, size));
            if (chosen.stream().allMatch(Card::isJoker)) {
                chosen.set(size - 1, group.get(0));
                chosen.sort(Comparator.comparingInt(positions::get));
            }
            Candidate candidate = new Candidate(MeldKind.SET, chosen, positionsOf(chosen, positions));
            if (best == null || PRIORITY.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        return best;
    }

    // ==================== SEQUENCES ====================

    private static Candidate bestSequence(List<Card> naturals, List<Card> jokers, Map<Card, Integer> positions) {
        Map<Suit, List<Card>> bySuit = new EnumMap<>(Suit.class);
        for (Card card : naturals) {
            bySuit.computeIfAbsent(card.getSuit(), s -> new ArrayList<>()).add(card);
        }

        Candidate best = null;
        for (List<Card> suited : bySuit.values()) {
            for (int aceValue : new int[] {Rank.ACE.getValue(), Rank.HIGH_ACE_VALUE}) {
                Candidate candidate = bestRun(suited, jokers, aceValue, positions);
                if (candidate != null && (best == null || PRIORITY.compare(candidate, best) < 0)) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    /**
     * Longest window of one suit's values that the jokers can close, with every joker used.
     */
    private static Candidate bestRun(List<Card> suited, List<Card> jokers, int aceValue,
                                     Map<Card, Integer> positions) {
        List<Card> run = distinctByValue(suited, aceValue, positions);
        int m = run.size();
        int[] values = new int[m];
        for (int i = 0; i < m; i++) {
            values[i] = run.get(i).getRank().valueWithAce(aceValue);
        }

        int budget = jokers.size();
        Candidate best = null;
        int j = 0;
        for (int i = 0; i < m; i++) {
            if (j < i) {
                j = i;
            }
            while (j + 1 < m && gaps(values, i, j + 1) <= budget) {
                j++;
            }
            int size = (j - i + 1) + budget;
            if (size < RulesEngine.MIN_SEQUENCE_SIZE) {
                continue;
            }
            List<Card> cards = arrange(run, values, i, j, jokers, aceValue);
            Candidate candidate = new Candidate(MeldKind.SEQUENCE, cards, positionsOf(cards, positions));
            if (best == null || PRIORITY.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        return best;
    }

    private static int gaps(int[] values, int from, int to) {
        return (values[to] - values[from]) - (to - from);
    }

    /**
     * Sort by value and keep the earliest card of any repeated value.
     */
    private static List<Card> distinctByValue(List<Card> suited, int aceValue, Map<Card, Integer> positions) {
        List<Card> sorted = new ArrayList<>(suited);
        sorted.sort(Comparator.<Card>comparingInt(c -> c.getRank().valueWithAce(aceValue))
                .thenComparingInt(positions::get));
        List<Card> distinct = new ArrayList<>(sorted.size());
        int lastValue = -1;
        for (Card card : sorted) {
            int value = card.getRank().valueWithAce(aceValue);
            if (value != lastValue) {
                distinct.add(card);
                lastValue = value;
            }
        }
        return distinct;
    }

    /**
     * Lay out the window in run order: jokers fill the gaps, spare jokers extend the top
     * and then the bottom.
     */
    private static List<Card> arrange(List<Card> run, int[] values, int from, int to,
                                      List<Card> jokers, int aceValue) {
        Deque<Card> spare = new ArrayDeque<>(jokers);
        List<Card> cards = new ArrayList<>();
        for (int k = from; k <= to; k++) {
            if (k > from) {
                for (int g = values[k] - values[k - 1] - 1; g > 0; g--) {
                    cards.add(spare.removeFirst());
                }
            }
            cards.add(run.get(k));
        }
        int ceiling = aceValue == Rank.HIGH_ACE_VALUE ? Rank.HIGH_ACE_VALUE : Rank.KING.getValue();
        int top = values[to];
        while (!spare.isEmpty() && top < ceiling) {
            cards.add(spare.removeFirst());
            top++;
        }
        while (!spare.isEmpty()) {
            cards.add(0, spare.removeFirst());
        }
        return cards;
    }

    // ==================== ORDERING ====================

    private static int[] positionsOf(List<Card> cards, Map<Card, Integer> positions) {
        int[] result = new int[cards.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = positions.get(cards.get(i));
        }
        Arrays.sort(result);
        return result;
    }

    private static int compareLexicographic(int[] a, int[] b) {
        return Arrays.compare(a, b);
    }

    private record Candidate(MeldKind kind, List<Card> cards, int[] positions) {
        int size() {
            return cards.size();
        }
    }
}
