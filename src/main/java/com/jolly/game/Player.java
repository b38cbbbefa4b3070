package com.jolly.game;

/**
 * The two seats at a Jolly table.
 */
public enum Player {
    ONE,
    TWO;

    public Player opponent() {
        return this == ONE ? TWO : ONE;
    }
}
