package com.jolly.rules;

import com.jolly.card.Card;
import com.jolly.card.Rank;
import com.jolly.card.Suit;
import com.jolly.game.Meld;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Jolly rules: meld validation, meld discovery, scoring and the discard heuristic.
 * Every method is static and pure; inputs are never modified, so the engine is safe
 * to call from any thread.
 */
public final class RulesEngine {

    public static final int MIN_SET_SIZE = 3;
    public static final int MAX_SET_SIZE = 4;
    public static final int MIN_SEQUENCE_SIZE = 3;
    public static final int FIRST_MELD_MIN_POINTS = 30;

    private static final int LOW_ACE = Rank.ACE.getValue();
    private static final int HIGH_ACE = Rank.HIGH_ACE_VALUE;

    private RulesEngine() {
        // Utility class - no instantiation
    }

    // ==================== VALIDATION ====================

    /**
     * A set is 3 or 4 cards where every non-joker shares one rank. Suits may repeat.
     */
    public static boolean isValidSet(List<Card> cards) {
        if (cards.size() < MIN_SET_SIZE || cards.size() > MAX_SET_SIZE) {
            return false;
        }
        Rank rank = null;
        for (Card card : cards) {
            if (card.isJoker()) {
                continue;
            }
            if (rank == null) {
                rank = card.getRank();
            } else if (card.getRank() != rank) {
                return false;
            }
        }
        // All jokers is not a set
        return rank != null;
    }

    /**
     * A sequence is 3+ cards of one suit whose values, with jokers filling the gaps,
     * are consecutive. The Ace may count as 1 or as 14; either reading is enough.
     */
    public static boolean isValidSequence(List<Card> cards) {
        if (cards.size() < MIN_SEQUENCE_SIZE) {
            return false;
        }
        List<Card> naturals = new ArrayList<>(cards.size());
        int jokers = 0;
        for (Card card : cards) {
            if (card.isJoker()) {
                jokers++;
            } else {
                naturals.add(card);
            }
        }
        if (naturals.isEmpty()) {
            return false;
        }
        Suit suit = naturals.get(0).getSuit();
        for (Card card : naturals) {
            if (card.getSuit() != suit) {
                return false;
            }
        }
        return fitsWithAceValue(naturals, jokers, LOW_ACE)
                || fitsWithAceValue(naturals, jokers, HIGH_ACE);
    }

    /**
     * Check whether the natural cards of one suit form a run with the given Ace value,
     * using at most {@code jokerCount} jokers for the gaps.
     */
    static boolean fitsWithAceValue(List<Card> naturals, int jokerCount, int aceValue) {
        int[] values = new int[naturals.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = naturals.get(i).getRank().valueWithAce(aceValue);
        }
        Arrays.sort(values);

        int jokersNeeded = 0;
        for (int i = 0; i < values.length - 1; i++) {
            int gap = values[i + 1] - values[i] - 1;
            if (gap < 0) {
                // Duplicate value
                return false;
            }
            jokersNeeded += gap;
        }
        return jokersNeeded <= jokerCount;
    }

    /**
     * A valid sequence without jokers.
     */
    public static boolean isPureSequence(List<Card> cards) {
        for (Card card : cards) {
            if (card.isJoker()) {
                return false;
            }
        }
        return isValidSequence(cards);
    }

    /**
     * Heuristic used for scoring: the naturals contain an Ace and a King but no Two,
     * so the Ace is read above the King. This does not re-validate the sequence.
     */
    public static boolean isHighAceSequence(List<Card> cards) {
        boolean hasAce = false;
        boolean hasKing = false;
        boolean hasTwo = false;
        for (Card card : cards) {
            if (card.isJoker()) {
                continue;
            }
            hasAce |= card.hasRank(Rank.ACE);
            hasKing |= card.hasRank(Rank.KING);
            hasTwo |= card.hasRank(Rank.TWO);
        }
        return hasAce && hasKing && !hasTwo;
    }

    // ==================== DISCOVERY ====================

    /**
     * Find non-overlapping melds in a hand.
     * Greedy and deterministic: the largest remaining candidate is taken first, a sequence
     * beats a set of the same size, and among equals the one whose cards sit earliest in
     * the hand wins. The cover is maximal, not necessarily the one with the most melds.
     *
     * @param hand cards in hand order
     * @return melds without owner, in the order they were accepted
     */
    public static List<Meld> findMelds(List<Card> hand) {
        return MeldFinder.find(hand);
    }

    /**
     * Cards of the hand not covered by any of the given melds, in hand order.
     */
    public static List<Card> unmatchedCards(List<Card> hand, List<Meld> melds) {
        Set<Card> covered = new HashSet<>();
        for (Meld meld : melds) {
            covered.addAll(meld.getCards());
        }
        List<Card> unmatched = new ArrayList<>();
        for (Card card : hand) {
            if (!covered.contains(card)) {
                unmatched.add(card);
            }
        }
        return unmatched;
    }

    // ==================== SCORING ====================

    /**
     * Meld value towards the first-meld requirement.
     * A set of exactly three natural Aces is worth a flat 25; otherwise each card adds
     * its meld value and each joker the rounded average of the meld's natural cards.
     */
    public static int calculateMeldPoints(Meld meld) {
        List<Card> cards = meld.getCards();
        if (isThreeAces(meld)) {
            return PointTable.THREE_ACES;
        }
        boolean highAce = meld.isSequence() && isHighAceSequence(cards);
        int jokerValue = estimateJokerValue(meld);
        int points = 0;
        for (Card card : cards) {
            points += card.isJoker() ? jokerValue : PointTable.meldValue(card, highAce);
        }
        return points;
    }

    private static boolean isThreeAces(Meld meld) {
        if (!meld.isSet() || meld.size() != MIN_SET_SIZE) {
            return false;
        }
        for (Card card : meld.getCards()) {
            if (card.isJoker() || !card.isAce()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Value of a joker in a meld: the rounded average meld value of its natural cards.
     */
    public static int estimateJokerValue(Meld meld) {
        List<Card> cards = meld.getCards();
        boolean highAce = meld.isSequence() && isHighAceSequence(cards);
        int total = 0;
        int naturals = 0;
        for (Card card : cards) {
            if (!card.isJoker()) {
                total += PointTable.meldValue(card, highAce);
                naturals++;
            }
        }
        if (naturals == 0) {
            return PointTable.DEFAULT_JOKER_MELD_VALUE;
        }
        return (int) Math.round((double) total / naturals);
    }

    public static int calculateTotalMeldPoints(List<Meld> melds) {
        int total = 0;
        for (Meld meld : melds) {
            total += calculateMeldPoints(meld);
        }
        return total;
    }

    public static boolean meetsFirstMeldRequirement(List<Meld> melds) {
        return meetsFirstMeldRequirement(melds, FIRST_MELD_MIN_POINTS);
    }

    public static boolean meetsFirstMeldRequirement(List<Meld> melds, int minimumPoints) {
        return calculateTotalMeldPoints(melds) >= minimumPoints;
    }

    /**
     * Penalty for cards left in hand at round end (hand table, not meld table).
     */
    public static int calculateHandPoints(List<Card> cards) {
        int total = 0;
        for (Card card : cards) {
            total += PointTable.handValue(card);
        }
        return total;
    }

    /**
     * Hand penalty of the cards {@link #findMelds} cannot place.
     */
    public static int calculateUnmatchedPoints(List<Card> cards) {
        return calculateHandPoints(unmatchedCards(cards, findMelds(cards)));
    }

    // ==================== TABLE CHECKS ====================

    /**
     * True if appending the card keeps the meld valid for its kind.
     */
    public static boolean canExtendMeld(Meld meld, Card card) {
        List<Card> extended = new ArrayList<>(meld.size() + 1);
        extended.addAll(meld.getCards());
        extended.add(card);
        return meld.isSet() ? isValidSet(extended) : isValidSequence(extended);
    }

    /**
     * A player may end the round (zudrehen) holding exactly one card that is not a joker
     * and fits none of the table melds.
     */
    public static boolean canEndRound(List<Card> hand, List<Meld> tableMelds) {
        if (hand.size() != 1) {
            return false;
        }
        Card last = hand.get(0);
        // A joker always finds a use
        if (last.isJoker()) {
            return false;
        }
        for (Meld meld : tableMelds) {
            if (canExtendMeld(meld, last)) {
                return false;
            }
        }
        return true;
    }

    // ==================== DISCARD ====================

    /**
     * Suggest a card to discard.
     * The highest-penalty natural card outside every discovered meld goes first; jokers are
     * kept when possible. A fully melded hand gives up the first card of its smallest meld.
     *
     * @param cards the hand, at least one card
     * @throws IllegalArgumentException if the hand is empty
     */
    public static Card suggestDiscard(List<Card> cards) {
        if (cards.isEmpty()) {
            throw new IllegalArgumentException("Cannot suggest a discard from an empty hand");
        }
        List<Meld> melds = findMelds(cards);
        List<Card> unmatched = unmatchedCards(cards, melds);

        if (!unmatched.isEmpty()) {
            Card highest = null;
            for (Card card : unmatched) {
                if (card.isJoker()) {
                    continue;
                }
                if (highest == null || PointTable.handValue(card) > PointTable.handValue(highest)) {
                    highest = card;
                }
            }
            return highest != null ? highest : unmatched.get(0);
        }

        Meld smallest = melds.get(0);
        for (Meld meld : melds) {
            if (meld.size() < smallest.size()) {
                smallest = meld;
            }
        }
        return smallest.getCards().get(0);
    }
}
