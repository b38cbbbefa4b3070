package com.jolly.game.zones;

import com.jolly.card.Card;
import com.jolly.card.Rank;
import com.jolly.card.Suit;
import com.jolly.rng.GameRng;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Draw pile. The top of the deck is the last element of the list, so draws are O(1).
 */
public class Deck {
    public static final int JOKER_COUNT = 8;
    public static final int FULL_SIZE = 52 + JOKER_COUNT;

    private final List<Card> cards;
    private final GameRng rng;

    /**
     * Create a deck holding the given cards in order (last card on top), without shuffling.
     */
    public Deck(List<Card> cards, GameRng rng) {
        this.cards = new ArrayList<>(cards);
        this.rng = rng;
    }

    /**
     * Build the canonical 60-card Jolly deck (52 standard cards and 8 jokers) and shuffle it.
     */
    public static Deck standard(GameRng rng) {
        Deck deck = new Deck(canonicalCards(), rng);
        deck.shuffle();
        return deck;
    }

    /**
     * The 60 cards in a fixed order: suits in sort priority, ranks Ace to King, then jokers.
     */
    public static List<Card> canonicalCards() {
        List<Card> all = new ArrayList<>(FULL_SIZE);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                all.add(Card.of(suit, rank));
            }
        }
        for (int i = 1; i <= JOKER_COUNT; i++) {
            all.add(Card.joker(i));
        }
        return all;
    }

    /**
     * Draw a card from the top of the deck.
     * @return The drawn card
     * @throws EmptyDeckException if the deck is empty
     */
    public Card draw() {
        if (cards.isEmpty()) {
            throw new EmptyDeckException();
        }
        return cards.remove(cards.size() - 1);
    }

    /**
     * Peek at the top card without removing it.
     */
    public Optional<Card> peekTop() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.get(cards.size() - 1));
    }

    /**
     * Put cards back (e.g. the discard row minus its top card) and reshuffle.
     */
    public void reshuffleIn(Collection<Card> returned) {
        cards.addAll(returned);
        shuffle();
    }

    /**
     * Unbiased Fisher-Yates shuffle driven by the deck's RNG.
     */
    public void shuffle() {
        rng.shuffle(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards, bottom first.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
