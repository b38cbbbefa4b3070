package com.jolly.ai;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * AI difficulty profile.
 *
 * @param name            display name
 * @param thinkTimeMillis pause before the AI acts; pacing only, never changes a decision
 * @param errorRate       probability in [0, 1] of replacing a reasoned choice by a random one
 * @param strategyDepth   1 to 3; depth 2 and above always lays melds and may end the round
 */
public record Difficulty(
        @JsonProperty("name") String name,
        @JsonProperty("think_time_ms") long thinkTimeMillis,
        @JsonProperty("error_rate") double errorRate,
        @JsonProperty("strategy_depth") int strategyDepth
) {
    public static final Difficulty EASY = new Difficulty("Easy", 1000, 0.30, 1);
    public static final Difficulty MEDIUM = new Difficulty("Medium", 1500, 0.15, 2);
    public static final Difficulty HARD = new Difficulty("Hard", 2000, 0.05, 3);

    public Difficulty {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Difficulty needs a name");
        }
        if (thinkTimeMillis < 0) {
            throw new IllegalArgumentException("think time cannot be negative: " + thinkTimeMillis);
        }
        if (errorRate < 0.0 || errorRate > 1.0 || Double.isNaN(errorRate)) {
            throw new IllegalArgumentException("error rate must be in [0, 1]: " + errorRate);
        }
        if (strategyDepth < 1 || strategyDepth > 3) {
            throw new IllegalArgumentException("strategy depth must be 1, 2 or 3: " + strategyDepth);
        }
    }

    @JsonIgnore
    public Duration thinkTime() {
        return Duration.ofMillis(thinkTimeMillis);
    }

    /**
     * Same profile without randomness, useful for reproducible analysis.
     */
    public Difficulty withoutErrors() {
        return new Difficulty(name, thinkTimeMillis, 0.0, strategyDepth);
    }
}
