package com.jolly.ai;

import com.jolly.card.Card;
import com.jolly.game.Meld;

import java.util.List;

/**
 * Outcome of one AI turn, applied by the controller.
 * The cards in {@code meldsLaid} and {@code card} have already left the AI's hand;
 * the controller puts the melds on the table and the card on the discard row.
 */
public record TurnResult(
    TurnAction action,

    /**
     * The discarded card, or for END_ROUND the card turned down. Null only if the hand was empty.
     */
    Card card,

    List<Meld> meldsLaid,

    DrawSource drawSource,

    /**
     * The card drawn this turn, null when nothing was drawn.
     */
    Card drawnCard
) {
    public TurnResult {
        meldsLaid = List.copyOf(meldsLaid);
    }

    public static TurnResult discard(Card card, List<Meld> meldsLaid, DrawSource source, Card drawn) {
        return new TurnResult(TurnAction.DISCARD, card, meldsLaid, source, drawn);
    }

    public static TurnResult endRound(Card lastCard, List<Meld> meldsLaid, DrawSource source, Card drawn) {
        return new TurnResult(TurnAction.END_ROUND, lastCard, meldsLaid, source, drawn);
    }

    public boolean isEndRound() {
        return action == TurnAction.END_ROUND;
    }

    public boolean hasCard() {
        return card != null;
    }
}
