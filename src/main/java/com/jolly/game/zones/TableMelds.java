package com.jolly.game.zones;

import com.jolly.card.Card;
import com.jolly.game.Meld;
import com.jolly.game.Player;
import com.jolly.rules.RulesEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Melds laid on the table by both players. Melds are never removed; they only grow.
 */
public class TableMelds {
    private final List<Meld> melds = new ArrayList<>();

    /**
     * Lay a meld. The meld must already carry its owner.
     */
    public void place(Meld meld) {
        Objects.requireNonNull(meld.getOwner(), "placed meld must have an owner");
        melds.add(meld);
    }

    public void placeAll(List<Meld> laid) {
        for (Meld meld : laid) {
            place(meld);
        }
    }

    /**
     * Append a card to the meld at {@code index} if it keeps the meld valid.
     * @return true if the card was added
     */
    public boolean extend(int index, Card card) {
        if (index < 0 || index >= melds.size()) {
            return false;
        }
        Meld meld = melds.get(index);
        if (!RulesEngine.canExtendMeld(meld, card)) {
            return false;
        }
        meld.append(card);
        return true;
    }

    public Meld get(int index) {
        return melds.get(index);
    }

    public int size() {
        return melds.size();
    }

    public boolean isEmpty() {
        return melds.isEmpty();
    }

    public List<Meld> ownedBy(Player player) {
        return melds.stream().filter(m -> m.getOwner() == player).toList();
    }

    /**
     * Total number of cards across all melds.
     */
    public int cardCount() {
        int count = 0;
        for (Meld meld : melds) {
            count += meld.size();
        }
        return count;
    }

    /**
     * Get an unmodifiable view of the melds.
     */
    public List<Meld> getMelds() {
        return List.copyOf(melds);
    }

    public List<Card> getAllCards() {
        List<Card> all = new ArrayList<>();
        for (Meld meld : melds) {
            all.addAll(meld.getCards());
        }
        return all;
    }
}
