package com.jolly.game;

/**
 * Meld kinds.
 */
public enum MeldKind {
    /** Three or four cards of one rank. */
    SET,
    /** Three or more consecutive cards of one suit. */
    SEQUENCE
}
