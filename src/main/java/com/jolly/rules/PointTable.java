package com.jolly.rules;

import com.jolly.card.Card;

/**
 * The two Jolly point tables. Meld values count towards the first-meld requirement;
 * hand values are the penalty for cards left in hand when a round ends.
 * The tables differ (an Ace is 5 or 10 in a meld but 25 in hand), so they stay apart.
 */
public final class PointTable {

    public static final int LOW_CARD = 5;
    public static final int HIGH_CARD = 10;

    /** Flat value of a set of exactly three Aces. */
    public static final int THREE_ACES = 25;

    public static final int ACE_IN_HAND = 25;
    public static final int JOKER_IN_HAND = 50;

    /** Joker value in a meld without any natural card to average over. */
    public static final int DEFAULT_JOKER_MELD_VALUE = LOW_CARD;

    private PointTable() {
        // Utility class - no instantiation
    }

    /**
     * Meld value of a natural card: 2-9 are 5, 10/J/Q/K are 10, an Ace is 5 low or 10 high.
     * Jokers are valued per meld, see {@link RulesEngine#estimateJokerValue}.
     */
    public static int meldValue(Card card, boolean highAce) {
        if (card.isJoker()) {
            return 0;
        }
        if (card.isAce()) {
            return highAce ? HIGH_CARD : LOW_CARD;
        }
        return card.getRank().isHighTier() ? HIGH_CARD : LOW_CARD;
    }

    /**
     * Penalty value of a card left in hand: 2-9 are 5, 10/J/Q/K are 10, Ace 25, joker 50.
     */
    public static int handValue(Card card) {
        if (card.isJoker()) {
            return JOKER_IN_HAND;
        }
        if (card.isAce()) {
            return ACE_IN_HAND;
        }
        return card.getRank().isHighTier() ? HIGH_CARD : LOW_CARD;
    }
}
