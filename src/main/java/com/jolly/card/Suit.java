package com.jolly.card;

/**
 * The four suits, declared in hand sort priority.
 */
public enum Suit {
    SPADES("♠"),
    HEARTS("♥"),
    DIAMONDS("♦"),
    CLUBS("♣");

    private final String symbol;

    Suit(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Resolve a suit from its letter (S, H, D, C) or its symbol.
     */
    public static Suit fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Suit cannot be null");
        }
        return switch (value.toUpperCase()) {
            case "S", "♠" -> SPADES;
            case "H", "♥" -> HEARTS;
            case "D", "♦" -> DIAMONDS;
            case "C", "♣" -> CLUBS;
            default -> throw new IllegalArgumentException("Unknown suit: " + value);
        };
    }
}
