package com.jolly.simulation;

import com.jolly.ai.AIStrategy;
import com.jolly.ai.TurnResult;
import com.jolly.card.Card;
import com.jolly.config.JollyConfig;
import com.jolly.game.Meld;
import com.jolly.game.Player;
import com.jolly.game.zones.Deck;
import com.jolly.game.zones.DiscardRow;
import com.jolly.game.zones.TableMelds;
import com.jolly.rng.GameRng;
import com.jolly.rules.RulesEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One round between two AI seats. Owns the deck, discard row and table for the round
 * and applies each {@link TurnResult}; no other actor touches the state during a turn.
 */
public class Round {
    private static final Logger log = LoggerFactory.getLogger(Round.class);

    private final JollyConfig config;
    private final Map<Player, AIStrategy> seats = new EnumMap<>(Player.class);
    private final Map<Player, Boolean> hasMelded = new EnumMap<>(Player.class);
    private final Deck deck;
    private final DiscardRow discardRow = new DiscardRow();
    private final TableMelds table = new TableMelds();
    private final int number;
    private final Player starter;
    private final boolean verbose;

    private Player toMove;
    private int turns;
    private RoundResult result;

    public Round(JollyConfig config, AIStrategy one, AIStrategy two, GameRng rng,
                 int number, Player starter, boolean verbose) {
        this.config = config;
        this.seats.put(Player.ONE, one);
        this.seats.put(Player.TWO, two);
        this.hasMelded.put(Player.ONE, false);
        this.hasMelded.put(Player.TWO, false);
        this.deck = Deck.standard(rng);
        this.number = number;
        this.starter = starter;
        this.toMove = starter;
        this.verbose = verbose;
    }

    /**
     * Deal: the starting player gets the larger hand and opens without drawing.
     */
    public void deal() {
        for (AIStrategy seat : seats.values()) {
            seat.getHand().clear();
        }
        dealTo(starter, config.getStartingHandSize());
        dealTo(starter.opponent(), config.getOtherHandSize());
        if (verbose) {
            System.out.println("\n=== ROUND " + number + " === (" + starter + " starts)");
            for (Map.Entry<Player, AIStrategy> e : seats.entrySet()) {
                AIStrategy seat = e.getValue();
                seat.getHand().sort();
                System.out.println("  " + e.getKey() + " (" + seat.getDifficulty().name() + "): "
                        + seat.getHand());
            }
        }
    }

    private void dealTo(Player player, int count) {
        AIStrategy seat = seats.get(player);
        for (int i = 0; i < count; i++) {
            seat.getHand().add(deck.draw());
        }
    }

    /**
     * Deal, then play turns until the round is over.
     */
    public RoundResult play() {
        deal();
        while (!isOver()) {
            playTurn();
        }
        return result;
    }

    /**
     * Play the next turn.
     * @return true once the round is over
     */
    public boolean playTurn() {
        if (isOver()) {
            return true;
        }
        if (turns >= config.getMaxTurnsPerRound()) {
            finish(null);
            return true;
        }

        AIStrategy seat = seats.get(toMove);
        TurnResult turn;
        if (turns == 0 && toMove == starter) {
            turn = seat.takeOpeningTurn(table, hasMelded.get(toMove));
        } else {
            if (deck.isEmpty()) {
                List<Card> back = discardRow.takeAllButTop();
                deck.reshuffleIn(back);
                if (verbose) {
                    System.out.println("[Reshuffle] " + back.size() + " cards back into the deck");
                }
            }
            if (deck.isEmpty()) {
                finish(null);
                return true;
            }
            turn = seat.takeTurn(deck, discardRow, table, hasMelded.get(toMove));
        }

        apply(toMove, turn);
        turns++;
        // Discarding the last card also goes out
        if (turn.isEndRound() || seat.getHand().isEmpty()) {
            finish(toMove);
            return true;
        }
        toMove = toMove.opponent();
        return false;
    }

    private void apply(Player player, TurnResult turn) {
        table.placeAll(turn.meldsLaid());
        if (!turn.meldsLaid().isEmpty()) {
            hasMelded.put(player, true);
        }
        if (turn.hasCard()) {
            discardRow.discard(turn.card());
        }
        if (verbose) {
            StringBuilder sb = new StringBuilder("[Turn " + (turns + 1) + "] " + player);
            if (turn.drawnCard() != null) {
                sb.append(" drew ").append(turn.drawnCard()).append(" from ").append(turn.drawSource());
            } else {
                sb.append(" opens");
            }
            for (Meld meld : turn.meldsLaid()) {
                sb.append(", laid ").append(meld).append(" (").append(RulesEngine.calculateMeldPoints(meld)).append(")");
            }
            if (turn.isEndRound()) {
                sb.append(", ends the round");
            } else if (turn.hasCard()) {
                sb.append(", discarded ").append(turn.card());
            }
            System.out.println(sb);
            System.out.println("  Discard row: " + discardRow.visible(config.getDiscardRowVisible()));
        }
    }

    private void finish(Player ender) {
        Map<Player, Integer> changes = new EnumMap<>(Player.class);
        for (Player player : Player.values()) {
            if (player == ender) {
                changes.put(player, -config.getZudrehenBonus());
            } else {
                changes.put(player, RulesEngine.calculateHandPoints(seats.get(player).getHand().getCards()));
            }
        }
        result = new RoundResult(number, ender, changes, turns);
        if (log.isDebugEnabled()) {
            log.debug("Round {} over after {} turns, ender {}, changes {}", number, turns, ender, changes);
        }
        if (verbose) {
            System.out.println("[End of Round " + number + "] "
                    + (ender == null ? "no cards left to play" : ender + " ended the round")
                    + ", score changes " + changes);
        }
    }

    public boolean isOver() {
        return result != null;
    }

    /**
     * Every card currently in the deck, the discard row, on the table and in both hands.
     */
    public List<Card> allCards() {
        List<Card> all = new ArrayList<>(deck.getCards());
        all.addAll(discardRow.getCards());
        all.addAll(table.getAllCards());
        for (AIStrategy seat : seats.values()) {
            all.addAll(seat.getHand().getCards());
        }
        return all;
    }

    public Deck getDeck() {
        return deck;
    }

    public DiscardRow getDiscardRow() {
        return discardRow;
    }

    public TableMelds getTable() {
        return table;
    }

    public boolean hasMelded(Player player) {
        return hasMelded.get(player);
    }

    public int getTurns() {
        return turns;
    }
}
