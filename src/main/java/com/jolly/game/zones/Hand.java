package com.jolly.game.zones;

import com.jolly.card.Card;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Cards held by one player, in display order.
 */
public class Hand {
    private final List<Card> cards;

    public Hand() {
        this.cards = new ArrayList<>();
    }

    public Hand(Collection<Card> initial) {
        this.cards = new ArrayList<>(initial);
    }

    public void clear() {
        cards.clear();
    }

    public void add(Card card) {
        cards.add(card);
    }

    public void addAll(Collection<Card> cardsToAdd) {
        cards.addAll(cardsToAdd);
    }

    /**
     * Remove a specific card by identity.
     * @param card The card to remove
     * @return true if the card was found and removed
     */
    public boolean remove(Card card) {
        return cards.remove(card);
    }

    /**
     * Remove every card of the collection.
     * @return true if all of them were present
     */
    public boolean removeAll(Collection<Card> toRemove) {
        boolean all = true;
        for (Card card : toRemove) {
            all &= cards.remove(card);
        }
        return all;
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Sort by suit priority, then rank value, jokers last.
     */
    public void sort() {
        cards.sort(Card.HAND_ORDER);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    @Override
    public String toString() {
        return cards.toString();
    }
}
