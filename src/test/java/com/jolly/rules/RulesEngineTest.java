package com.jolly.rules;

import com.jolly.card.Card;
import com.jolly.card.CardNotation;
import com.jolly.card.CardNotationException;
import com.jolly.game.Meld;
import com.jolly.game.MeldKind;
import com.jolly.game.zones.Deck;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RulesEngine validation, scoring and table checks.
 */
class RulesEngineTest {

    private static List<Card> cards(String line) {
        try {
            return CardNotation.parseLine(line);
        } catch (CardNotationException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static Meld set(String line) {
        return new Meld(MeldKind.SET, cards(line));
    }

    private static Meld sequence(String line) {
        return new Meld(MeldKind.SEQUENCE, cards(line));
    }

    // ==================== SETS ====================

    @Test
    void testSingleCardIsNeverASet() {
        for (Card card : Deck.canonicalCards()) {
            assertFalse(RulesEngine.isValidSet(List.of(card)), card + " alone is not a set");
        }
    }

    @Test
    void testValidSets() {
        assertTrue(RulesEngine.isValidSet(cards("7S 7H 7D")));
        assertTrue(RulesEngine.isValidSet(cards("7S 7H 7D 7C")));
        assertTrue(RulesEngine.isValidSet(cards("7S 7H JK")));
        assertTrue(RulesEngine.isValidSet(cards("7S JK JK")));
    }

    @Test
    void testInvalidSets() {
        assertFalse(RulesEngine.isValidSet(cards("7S 7H")));
        assertFalse(RulesEngine.isValidSet(cards("7S 7H 8D")));
        assertFalse(RulesEngine.isValidSet(cards("7S 7H 7D 7C JK")));
        assertFalse(RulesEngine.isValidSet(cards("JK JK JK")));
    }

    // ==================== SEQUENCES ====================

    @Test
    void testLowAceSequence() {
        assertTrue(RulesEngine.isValidSequence(cards("AS 2S 3S")));
        assertFalse(RulesEngine.isHighAceSequence(cards("AS 2S 3S")));
    }

    @Test
    void testHighAceSequence() {
        assertTrue(RulesEngine.isValidSequence(cards("QS KS AS")));
        assertTrue(RulesEngine.isHighAceSequence(cards("QS KS AS")));
    }

    @Test
    void testNoWrapAround() {
        assertFalse(RulesEngine.isValidSequence(cards("KS AS 2S")));
    }

    @Test
    void testJokersFillGaps() {
        assertTrue(RulesEngine.isValidSequence(cards("5S JK 7S")));
        assertTrue(RulesEngine.isValidSequence(cards("5S JK JK 8S")));
        assertFalse(RulesEngine.isValidSequence(cards("5S JK 9S")));
        assertFalse(RulesEngine.isValidSequence(cards("5S JK JK 9S")));
        assertTrue(RulesEngine.isValidSequence(cards("5S JK JK JK 9S")));
    }

    @Test
    void testSpareJokersExtendTheRun() {
        assertTrue(RulesEngine.isValidSequence(cards("5S 6S JK")));
        assertTrue(RulesEngine.isValidSequence(cards("5S JK JK")));
    }

    @Test
    void testInvalidSequences() {
        assertFalse(RulesEngine.isValidSequence(cards("5S 6S")));
        assertFalse(RulesEngine.isValidSequence(cards("5S 6H 7S")));
        assertFalse(RulesEngine.isValidSequence(cards("JK JK JK")));
        assertFalse(RulesEngine.isValidSequence(cards("5S 5H 6S")));
    }

    @Test
    void testPureSequence() {
        assertTrue(RulesEngine.isPureSequence(cards("9D 10D JD")));
        assertFalse(RulesEngine.isPureSequence(cards("9D JK JD")));
        assertFalse(RulesEngine.isPureSequence(cards("9D 9H 9C")));
        assertTrue(sequence("9D 10D JD").isPure());
    }

    // ==================== SCORING ====================

    @Test
    void testLowAceSequencePoints() {
        assertEquals(3 * PointTable.LOW_CARD, RulesEngine.calculateMeldPoints(sequence("AS 2S 3S")));
    }

    @Test
    void testHighAceSequencePoints() {
        assertEquals(3 * PointTable.HIGH_CARD, RulesEngine.calculateMeldPoints(sequence("QS KS AS")));
    }

    @Test
    void testThreeAcesBonus() {
        assertEquals(PointTable.THREE_ACES, RulesEngine.calculateMeldPoints(set("AS AH AD")));
    }

    @Test
    void testFourAcesHaveNoBonus() {
        assertEquals(4 * PointTable.LOW_CARD, RulesEngine.calculateMeldPoints(set("AS AH AD AC")));
    }

    @Test
    void testAcesWithJokerHaveNoBonus() {
        assertEquals(3 * PointTable.LOW_CARD, RulesEngine.calculateMeldPoints(set("AS AH JK")));
    }

    @Test
    void testJokerTakesAverageValue() {
        assertEquals(30, RulesEngine.calculateMeldPoints(set("QS QH JK")));
        assertEquals(15, RulesEngine.calculateMeldPoints(sequence("5S JK 7S")));
        // 5 and 10 average to 7.5, rounded to 8
        assertEquals(8, RulesEngine.estimateJokerValue(sequence("9S 10S JK")));
        assertEquals(23, RulesEngine.calculateMeldPoints(sequence("9S 10S JK")));
    }

    @Test
    void testJokerOnlyMeldDefaultValue() {
        assertEquals(PointTable.DEFAULT_JOKER_MELD_VALUE, RulesEngine.estimateJokerValue(set("JK JK JK")));
    }

    @Test
    void testFirstMeldRequirement() {
        assertTrue(RulesEngine.meetsFirstMeldRequirement(List.of(sequence("QS KS AS"))));
        assertFalse(RulesEngine.meetsFirstMeldRequirement(List.of(sequence("AS 2S 3S"))));
        assertTrue(RulesEngine.meetsFirstMeldRequirement(
                List.of(sequence("AS 2S 3S"), set("4H 4D 4C"))));
        assertTrue(RulesEngine.meetsFirstMeldRequirement(List.of(sequence("AS 2S 3S")), 15));
        assertFalse(RulesEngine.meetsFirstMeldRequirement(List.of()));
    }

    @Test
    void testHandPoints() {
        assertEquals(PointTable.LOW_CARD, RulesEngine.calculateHandPoints(cards("7H")));
        assertEquals(PointTable.HIGH_CARD, RulesEngine.calculateHandPoints(cards("KC")));
        assertEquals(PointTable.ACE_IN_HAND, RulesEngine.calculateHandPoints(cards("AD")));
        assertEquals(PointTable.JOKER_IN_HAND, RulesEngine.calculateHandPoints(cards("JK")));
        assertEquals(90, RulesEngine.calculateHandPoints(cards("7H KC AD JK")));
        assertEquals(0, RulesEngine.calculateHandPoints(List.of()));
    }

    @Test
    void testUnmatchedPoints() {
        assertEquals(PointTable.ACE_IN_HAND, RulesEngine.calculateUnmatchedPoints(cards("7S 8S 9S AC")));
        assertEquals(0, RulesEngine.calculateUnmatchedPoints(cards("7S 8S 9S")));
    }

    // ==================== TABLE CHECKS ====================

    @Test
    void testCanExtendMeld() {
        Meld run = sequence("5S 6S 7S");
        assertTrue(RulesEngine.canExtendMeld(run, cards("8S").get(0)));
        assertTrue(RulesEngine.canExtendMeld(run, cards("4S").get(0)));
        assertTrue(RulesEngine.canExtendMeld(run, Card.joker(1)));
        assertFalse(RulesEngine.canExtendMeld(run, cards("8H").get(0)));
        assertFalse(RulesEngine.canExtendMeld(run, cards("9S").get(0)));

        Meld fours = set("4H 4D 4C");
        assertTrue(RulesEngine.canExtendMeld(fours, cards("4S").get(0)));
        assertFalse(RulesEngine.canExtendMeld(set("4H 4D 4C 4S"), Card.joker(1)));
    }

    @Test
    void testEndRoundEligibility() {
        List<Meld> table = List.of(set("7S 7H 7D"), sequence("5C 6C 7C"));

        assertTrue(RulesEngine.canEndRound(cards("KD"), table));
        assertTrue(RulesEngine.canEndRound(cards("KD"), List.of()));
        assertFalse(RulesEngine.canEndRound(cards("8C"), table));
        assertFalse(RulesEngine.canEndRound(cards("7C"), List.of(set("7S 7H 7D"))));
        assertFalse(RulesEngine.canEndRound(cards("KD QD"), table));
        assertFalse(RulesEngine.canEndRound(List.of(), table));
    }

    @Test
    void testJokerNeverEndsRound() {
        assertFalse(RulesEngine.canEndRound(List.of(Card.joker(1)), List.of()));
        assertFalse(RulesEngine.canEndRound(List.of(Card.joker(1)), List.of(set("4H 4D 4C 4S"))));
    }

    // ==================== DISCARD ====================

    @Test
    void testDiscardHighestUnmatched() {
        assertEquals(cards("KH").get(0), RulesEngine.suggestDiscard(cards("7S 8S 9S KH 3D")));
        assertEquals(cards("AC").get(0), RulesEngine.suggestDiscard(cards("7S 8S 9S KH AC")));
    }

    @Test
    void testDiscardKeepsJokers() {
        assertEquals(cards("2D").get(0), RulesEngine.suggestDiscard(cards("JK 2D")));
        assertEquals(Card.joker(1), RulesEngine.suggestDiscard(cards("JK1")));
    }

    @Test
    void testDiscardFromFullyMeldedHand() {
        assertEquals(cards("7S").get(0), RulesEngine.suggestDiscard(cards("7S 8S 9S QH QD QC")));
    }

    @Test
    void testDiscardFromEmptyHand() {
        assertThrows(IllegalArgumentException.class, () -> RulesEngine.suggestDiscard(List.of()));
    }

    @Test
    void testInputsAreNotModified() {
        List<Card> hand = new ArrayList<>(cards("7S 8S 9S KH JK"));
        List<Card> copy = List.copyOf(hand);

        RulesEngine.findMelds(hand);
        RulesEngine.suggestDiscard(hand);
        RulesEngine.calculateUnmatchedPoints(hand);

        assertEquals(copy, hand);
    }
}
