package com.jolly.ai;

/**
 * Where a turn's card came from.
 */
public enum DrawSource {
    DECK,
    DISCARD_ROW,
    /** Opening turn of the player dealt the extra card, or nothing left to draw. */
    NONE
}
