package com.jolly.ai;

import com.jolly.card.Card;
import com.jolly.game.Meld;
import com.jolly.game.Player;
import com.jolly.game.zones.Deck;
import com.jolly.game.zones.DiscardRow;
import com.jolly.game.zones.Hand;
import com.jolly.game.zones.TableMelds;
import com.jolly.rng.GameRng;
import com.jolly.rules.RulesEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Computer opponent. One turn runs four stages in a single pass:
 * draw source, melds to lay, end-round check, discard.
 * Every random choice goes through the seat's {@link GameRng}, so a turn replays from its seed.
 */
public class AIStrategy {
    private static final Logger log = LoggerFactory.getLogger(AIStrategy.class);

    private static final Duration STAGE_PAUSE = Duration.ofMillis(500);

    private final Player seat;
    private final Difficulty difficulty;
    private final GameRng rng;
    private final Pacer pacer;
    private final int firstMeldMinPoints;
    private final Hand hand = new Hand();

    public AIStrategy(Player seat, Difficulty difficulty, GameRng rng) {
        this(seat, difficulty, rng, Pacer.NONE, RulesEngine.FIRST_MELD_MIN_POINTS);
    }

    public AIStrategy(Player seat, Difficulty difficulty, GameRng rng, Pacer pacer, int firstMeldMinPoints) {
        this.seat = seat;
        this.difficulty = difficulty;
        this.rng = rng;
        this.pacer = pacer;
        this.firstMeldMinPoints = firstMeldMinPoints;
    }

    public Player getSeat() {
        return seat;
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    public Hand getHand() {
        return hand;
    }

    // ==================== TURN PIPELINE ====================

    /**
     * Play one turn. Draws from the deck or the discard row (mutating them), lays melds and
     * discards or ends the round. Laid melds and the returned card are removed from the hand;
     * placing them on the table and the discard row is left to the caller.
     *
     * @param hasMelded whether this player has already met the first-meld requirement
     */
    public TurnResult takeTurn(Deck deck, DiscardRow discardRow, TableMelds tableMelds, boolean hasMelded) {
        pacer.await(difficulty.thinkTime());

        DrawSource source = chooseDrawSource(discardRow.top().orElse(null), hasMelded);
        if (source == DrawSource.DISCARD_ROW && discardRow.isEmpty()) {
            source = DrawSource.DECK;
        }
        if (source == DrawSource.DECK && deck.isEmpty()) {
            source = hasMelded && !discardRow.isEmpty() ? DrawSource.DISCARD_ROW : DrawSource.NONE;
        }

        Card drawn = switch (source) {
            case DECK -> deck.draw();
            case DISCARD_ROW -> discardRow.takeTop().orElseThrow();
            case NONE -> null;
        };
        if (drawn != null) {
            hand.add(drawn);
        }
        if (log.isDebugEnabled()) {
            log.debug("{} drew {} from {}", seat, drawn, source);
        }

        pacer.await(STAGE_PAUSE);
        return finishTurn(source, drawn, tableMelds, hasMelded);
    }

    /**
     * Opening turn of the player dealt the extra card: no draw, straight to laying and discarding.
     */
    public TurnResult takeOpeningTurn(TableMelds tableMelds, boolean hasMelded) {
        pacer.await(difficulty.thinkTime());
        return finishTurn(DrawSource.NONE, null, tableMelds, hasMelded);
    }

    private TurnResult finishTurn(DrawSource source, Card drawn, TableMelds tableMelds, boolean hasMelded) {
        List<Meld> laid = chooseMeldsToLay(hand.getCards(), hasMelded);
        for (Meld meld : laid) {
            hand.removeAll(meld.getCards());
        }
        if (!laid.isEmpty() && log.isDebugEnabled()) {
            log.debug("{} lays {} ({} points)", seat, laid, RulesEngine.calculateTotalMeldPoints(laid));
        }

        List<Meld> visible = new ArrayList<>(tableMelds.getMelds());
        visible.addAll(laid);
        List<Card> remaining = hand.getCards();

        if (remaining.isEmpty()) {
            return TurnResult.endRound(null, laid, source, drawn);
        }

        if (shouldEndRound(remaining, visible)) {
            Card last = remaining.get(0);
            hand.remove(last);
            if (log.isDebugEnabled()) {
                log.debug("{} ends the round turning down {}", seat, last);
            }
            return TurnResult.endRound(last, laid, source, drawn);
        }

        pacer.await(STAGE_PAUSE);
        Card discard = chooseDiscard(remaining);
        hand.remove(discard);
        if (log.isDebugEnabled()) {
            log.debug("{} discards {}", seat, discard);
        }
        return TurnResult.discard(discard, laid, source, drawn);
    }

    // ==================== DECISIONS ====================

    /**
     * Choose where to draw from.
     * Before the first meld only the deck is allowed. Afterwards the discard-row top is taken
     * when it lets {@link RulesEngine#findMelds} find strictly more melds, except that with
     * probability {@code errorRate} the source is a coin flip.
     *
     * @param discardTop top of the discard row, or null if it is empty
     */
    public DrawSource chooseDrawSource(Card discardTop, boolean hasMelded) {
        if (!hasMelded || discardTop == null) {
            return DrawSource.DECK;
        }
        if (rng.chance(difficulty.errorRate())) {
            return rng.coinFlip() ? DrawSource.DISCARD_ROW : DrawSource.DECK;
        }

        List<Card> current = hand.getCards();
        List<Card> withTop = new ArrayList<>(current);
        withTop.add(discardTop);
        int without = RulesEngine.findMelds(current).size();
        int with = RulesEngine.findMelds(withTop).size();
        return with > without ? DrawSource.DISCARD_ROW : DrawSource.DECK;
    }

    /**
     * Choose the melds to lay from the given cards, owned by this seat.
     * <p>
     * For a first meld, the smallest combination of discovered melds (fewest melds, earliest
     * first) that reaches the first-meld threshold, or nothing. After that, every discovered
     * meld at strategy depth 2+, and at depth 1 only on a coin flip.
     * A lay never uses up the whole hand: one card must stay to discard or turn down.
     */
    public List<Meld> chooseMeldsToLay(List<Card> cards, boolean hasMelded) {
        List<Meld> found = RulesEngine.findMelds(cards);
        if (found.isEmpty()) {
            return List.of();
        }

        List<Meld> lay;
        if (!hasMelded) {
            lay = smallestQualifyingCombination(found, cards.size());
        } else if (difficulty.strategyDepth() >= 2 || rng.coinFlip()) {
            lay = keepOneCardBack(found, cards.size());
        } else {
            lay = List.of();
        }
        return lay.stream().map(m -> m.ownedBy(seat)).toList();
    }

    private List<Meld> smallestQualifyingCombination(List<Meld> found, int handSize) {
        int n = found.size();
        for (int k = 1; k <= n; k++) {
            int[] idx = new int[k];
            for (int i = 0; i < k; i++) {
                idx[i] = i;
            }
            while (true) {
                List<Meld> combination = new ArrayList<>(k);
                int cardCount = 0;
                for (int i : idx) {
                    combination.add(found.get(i));
                    cardCount += found.get(i).size();
                }
                if (cardCount < handSize
                        && RulesEngine.meetsFirstMeldRequirement(combination, firstMeldMinPoints)) {
                    return combination;
                }
                if (!nextCombination(idx, n)) {
                    break;
                }
            }
        }
        return List.of();
    }

    /**
     * Advance to the next k-combination of [0, n) in lexicographic order.
     * @return false when {@code idx} was the last combination
     */
    private static boolean nextCombination(int[] idx, int n) {
        int k = idx.length;
        int i = k - 1;
        while (i >= 0 && idx[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        idx[i]++;
        for (int j = i + 1; j < k; j++) {
            idx[j] = idx[j - 1] + 1;
        }
        return true;
    }

    private static List<Meld> keepOneCardBack(List<Meld> found, int handSize) {
        int cardCount = 0;
        Meld smallest = found.get(0);
        for (Meld meld : found) {
            cardCount += meld.size();
            if (meld.size() < smallest.size()) {
                smallest = meld;
            }
        }
        if (cardCount < handSize) {
            return found;
        }
        List<Meld> lay = new ArrayList<>(found);
        lay.remove(smallest);
        return lay;
    }

    /**
     * End the round when the single remaining card is a natural card that fits no visible
     * meld. Only profiles with strategy depth 2+ take the chance.
     */
    public boolean shouldEndRound(List<Card> remaining, List<Meld> visibleMelds) {
        return difficulty.strategyDepth() >= 2 && RulesEngine.canEndRound(remaining, visibleMelds);
    }

    /**
     * Pick the discard: random with probability {@code errorRate}, otherwise
     * {@link RulesEngine#suggestDiscard}.
     */
    public Card chooseDiscard(List<Card> cards) {
        if (rng.chance(difficulty.errorRate())) {
            return rng.pick(cards);
        }
        return RulesEngine.suggestDiscard(cards);
    }
}
