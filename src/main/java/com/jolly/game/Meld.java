package com.jolly.game;

import com.jolly.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A set or sequence of cards. Melds found in a hand have no owner; once laid on
 * the table they belong to the laying player but can be extended by either player.
 */
public class Meld {
    private final MeldKind kind;
    private final List<Card> cards;
    private final Player owner;

    public Meld(MeldKind kind, List<Card> cards) {
        this(kind, cards, null);
    }

    public Meld(MeldKind kind, List<Card> cards, Player owner) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.cards = new ArrayList<>(cards);
        this.owner = owner;
    }

    /**
     * Copy of this meld owned by the given player.
     */
    public Meld ownedBy(Player player) {
        return new Meld(kind, cards, player);
    }

    public MeldKind getKind() {
        return kind;
    }

    public boolean isSet() {
        return kind == MeldKind.SET;
    }

    public boolean isSequence() {
        return kind == MeldKind.SEQUENCE;
    }

    /**
     * @return the owning player, or null while the meld is still in a hand
     */
    public Player getOwner() {
        return owner;
    }

    /**
     * A sequence without jokers. Derived from the current cards, so it follows extensions.
     */
    public boolean isPure() {
        return kind == MeldKind.SEQUENCE && cards.stream().noneMatch(Card::isJoker);
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Append a card. Callers check {@code RulesEngine.canExtendMeld} first.
     */
    public void append(Card card) {
        cards.add(Objects.requireNonNull(card, "card"));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind == MeldKind.SET ? "Set[" : "Sequence[");
        for (int i = 0; i < cards.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(cards.get(i).notation());
        }
        return sb.append(']').toString();
    }
}
