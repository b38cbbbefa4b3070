package com.jolly.ai;

/**
 * How an AI turn ends.
 */
public enum TurnAction {
    /** Zudrehen: the last card is turned down and the round is over. */
    END_ROUND,
    DISCARD
}
