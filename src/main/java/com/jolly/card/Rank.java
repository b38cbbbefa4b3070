package com.jolly.card;

/**
 * Card ranks with their numeric value (Ace low).
 */
public enum Rank {
    ACE("A", 1),
    TWO("2", 2),
    THREE("3", 3),
    FOUR("4", 4),
    FIVE("5", 5),
    SIX("6", 6),
    SEVEN("7", 7),
    EIGHT("8", 8),
    NINE("9", 9),
    TEN("10", 10),
    JACK("J", 11),
    QUEEN("Q", 12),
    KING("K", 13);

    /** Value of an Ace played above the King. */
    public static final int HIGH_ACE_VALUE = 14;

    private final String symbol;
    private final int value;

    Rank(String symbol, int value) {
        this.symbol = symbol;
        this.value = value;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getValue() {
        return value;
    }

    /**
     * Value of this rank when Aces count as {@code aceValue} (1 or 14).
     */
    public int valueWithAce(int aceValue) {
        return this == ACE ? aceValue : value;
    }

    /**
     * Ten and the face cards.
     */
    public boolean isHighTier() {
        return value >= 10;
    }

    public static Rank fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rank cannot be null");
        }
        String upper = value.toUpperCase();
        for (Rank rank : values()) {
            if (rank.symbol.equals(upper)) {
                return rank;
            }
        }
        if (upper.equals("T")) {
            return TEN;
        }
        throw new IllegalArgumentException("Unknown rank: " + value);
    }
}
