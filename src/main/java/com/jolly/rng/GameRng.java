package com.jolly.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator shared by the deck shuffle and AI decisions.
 * Uses the Mulberry32 PRNG so a whole match replays exactly from its seed.
 * Not thread-safe; each match owns its own instance.
 */
public class GameRng {
    private final long seed;
    private long state;

    /**
     * Create a new GameRng with the specified seed. Only the lower 32 bits are used.
     */
    public GameRng(long seed) {
        this.seed = seed;
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Next random number in [0, 1).
     */
    public double next() {
        return nextInt32() / 4294967296.0;
    }

    /**
     * Raw 32-bit Mulberry32 output in [0, 2^32).
     */
    long nextInt32() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;
        return (t ^ (t >>> 14)) & 0xFFFFFFFFL;
    }

    /**
     * Random integer in [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) Math.floor(next() * bound);
    }

    /**
     * True with the given probability. A probability of 0 never draws a number,
     * so error-free profiles leave the sequence untouched.
     */
    public boolean chance(double probability) {
        if (probability <= 0.0) {
            return false;
        }
        return next() < probability;
    }

    public boolean coinFlip() {
        return next() < 0.5;
    }

    /**
     * Uniformly pick one element of a non-empty list.
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    /**
     * Fisher-Yates shuffle in place.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Derive an independent generator, e.g. one per AI seat or per round deck.
     * The child seed carries a full 64 bits of output; its state takes the low 32.
     */
    public GameRng fork() {
        return new GameRng((nextInt32() << 32 | nextInt32()) ^ seed);
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
