package com.jolly.ai;

import java.time.Duration;

/**
 * Paces the AI between decision stages so a human can follow it.
 * Decisions never depend on pacing; tests and simulations use {@link #NONE}.
 */
public interface Pacer {

    /** Skips every pause. */
    Pacer NONE = delay -> { };

    /**
     * Wait up to {@code delay}. Implementations may return early when cancelled.
     */
    void await(Duration delay);
}
