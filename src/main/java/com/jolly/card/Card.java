package com.jolly.card;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Objects;

/**
 * A physical playing card or a Jolly (joker).
 * Immutable. Equality is by identity key, so the eight jokers stay distinguishable
 * and two cards of the same rank in different suits never compare equal.
 */
public final class Card {

    /**
     * Hand display order: Spades, Hearts, Diamonds, Clubs, then rank value, jokers last.
     */
    public static final Comparator<Card> HAND_ORDER = (a, b) -> {
        if (a.joker != b.joker) {
            return a.joker ? 1 : -1;
        }
        if (a.joker) {
            return 0;
        }
        int bySuit = Integer.compare(a.suit.ordinal(), b.suit.ordinal());
        if (bySuit != 0) {
            return bySuit;
        }
        return Integer.compare(a.rank.getValue(), b.rank.getValue());
    };

    private final Suit suit;
    private final Rank rank;
    private final boolean joker;
    private final String id;

    private Card(Suit suit, Rank rank, boolean joker, String id) {
        this.suit = suit;
        this.rank = rank;
        this.joker = joker;
        this.id = id;
    }

    public static Card of(Suit suit, Rank rank) {
        Objects.requireNonNull(suit, "suit");
        Objects.requireNonNull(rank, "rank");
        return new Card(suit, rank, false, suit.name() + "-" + rank.getSymbol());
    }

    /**
     * Create the joker with the given serial number (1-based within a deck).
     */
    public static Card joker(int serial) {
        if (serial < 1) {
            throw new IllegalArgumentException("Joker serial must be positive: " + serial);
        }
        return new Card(null, null, true, "JOKER-" + serial);
    }

    /**
     * @return the suit, or null for a joker
     */
    public Suit getSuit() {
        return suit;
    }

    /**
     * @return the rank, or null for a joker
     */
    public Rank getRank() {
        return rank;
    }

    public boolean isJoker() {
        return joker;
    }

    public boolean isAce() {
        return rank == Rank.ACE;
    }

    public boolean hasRank(Rank other) {
        return rank == other;
    }

    /**
     * Numeric rank value with Ace = 1, J = 11, Q = 12, K = 13 and 0 for a joker.
     */
    public int getValue() {
        return joker ? 0 : rank.getValue();
    }

    public String getId() {
        return id;
    }

    /**
     * Short notation such as {@code 7♠}, {@code 10♥} or {@code JK3}.
     */
    @JsonValue
    public String notation() {
        if (joker) {
            return "JK" + id.substring("JOKER-".length());
        }
        return rank.getSymbol() + suit.getSymbol();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card other)) {
            return false;
        }
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return joker ? "JOKER" : rank.getSymbol() + suit.getSymbol();
    }
}
