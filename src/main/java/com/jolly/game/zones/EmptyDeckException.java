package com.jolly.game.zones;

import java.util.NoSuchElementException;

/**
 * Thrown when drawing from an exhausted deck. Controllers check {@link Deck#isEmpty()}
 * and reshuffle the discard row before a draw.
 */
public class EmptyDeckException extends NoSuchElementException {
    public EmptyDeckException() {
        super("Cannot draw from empty deck");
    }
}
