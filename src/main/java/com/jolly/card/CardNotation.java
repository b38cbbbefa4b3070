package com.jolly.card;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses short card notation: rank followed by suit letter or symbol
 * ({@code AS}, {@code 10H}, {@code Q♦}), and {@code JK} or {@code JK<n>} for jokers.
 */
public final class CardNotation {

    private static final int MAX_JOKERS = 8;

    private CardNotation() {
        // Utility class - no instantiation
    }

    /**
     * Parse a single card. A bare {@code JK} becomes joker number 1.
     *
     * @throws CardNotationException if the text is not a card
     */
    public static Card parse(String text) throws CardNotationException {
        List<Card> cards = parseAll(List.of(text));
        return cards.get(0);
    }

    /**
     * Parse a whitespace or comma separated list of cards.
     */
    public static List<Card> parseLine(String line) throws CardNotationException {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        return parseAll(List.of(line.trim().split("[\\s,]+")));
    }

    /**
     * Parse a list of tokens. Bare {@code JK} tokens get the lowest joker serial
     * not already taken within the list, so every parsed joker keeps its own identity.
     *
     * @throws CardNotationException on an unknown token or a repeated card
     */
    public static List<Card> parseAll(List<String> tokens) throws CardNotationException {
        Set<Integer> takenSerials = new HashSet<>();
        for (String token : tokens) {
            String t = token == null ? "" : token.trim().toUpperCase();
            if (t.startsWith("JK") && t.length() > 2) {
                takenSerials.add(parseSerial(t));
            }
        }

        List<Card> cards = new ArrayList<>(tokens.size());
        Set<Card> seen = new HashSet<>();
        int nextSerial = 1;
        for (String token : tokens) {
            if (token == null || token.isBlank()) {
                throw new CardNotationException("Empty card token");
            }
            String t = token.trim().toUpperCase();
            Card card;
            if (t.equals("JK") || t.equals("JOKER")) {
                while (takenSerials.contains(nextSerial)) {
                    nextSerial++;
                }
                if (nextSerial > MAX_JOKERS) {
                    throw new CardNotationException("More than " + MAX_JOKERS + " jokers");
                }
                takenSerials.add(nextSerial);
                card = Card.joker(nextSerial);
            } else if (t.startsWith("JK")) {
                card = Card.joker(parseSerial(t));
            } else {
                card = parseStandard(t, token);
            }
            if (!seen.add(card)) {
                throw new CardNotationException("Card listed twice: " + token.trim());
            }
            cards.add(card);
        }
        return cards;
    }

    private static int parseSerial(String t) throws CardNotationException {
        try {
            int serial = Integer.parseInt(t.substring(2));
            if (serial < 1 || serial > MAX_JOKERS) {
                throw new CardNotationException("Joker number out of range: " + t);
            }
            return serial;
        } catch (NumberFormatException e) {
            throw new CardNotationException("Invalid joker: " + t, e);
        }
    }

    private static Card parseStandard(String t, String original) throws CardNotationException {
        if (t.length() < 2) {
            throw new CardNotationException("Invalid card: " + original);
        }
        // Suit symbols are a single UTF-16 char, letters too
        String rankPart = t.substring(0, t.length() - 1);
        String suitPart = t.substring(t.length() - 1);
        try {
            return Card.of(Suit.fromString(suitPart), Rank.fromString(rankPart));
        } catch (IllegalArgumentException e) {
            throw new CardNotationException("Invalid card '" + original + "': " + e.getMessage(), e);
        }
    }
}
