package com.jolly.game.zones;

import com.jolly.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The visible row of discarded cards. Only the most recent card (the top) can be taken.
 */
public class DiscardRow {
    private final List<Card> cards = new ArrayList<>();

    public void discard(Card card) {
        cards.add(card);
    }

    public Optional<Card> top() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.get(cards.size() - 1));
    }

    /**
     * Take the top card.
     * @return the top card, or empty if the row is empty
     */
    public Optional<Card> takeTop() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.remove(cards.size() - 1));
    }

    /**
     * Remove and return everything except the top card, oldest first. Used to refill the deck.
     */
    public List<Card> takeAllButTop() {
        if (cards.size() <= 1) {
            return List.of();
        }
        List<Card> taken = new ArrayList<>(cards.subList(0, cards.size() - 1));
        cards.subList(0, cards.size() - 1).clear();
        return taken;
    }

    /**
     * The most recent {@code max} cards, oldest first.
     */
    public List<Card> visible(int max) {
        int from = Math.max(0, cards.size() - max);
        return List.copyOf(cards.subList(from, cards.size()));
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards, oldest first.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
