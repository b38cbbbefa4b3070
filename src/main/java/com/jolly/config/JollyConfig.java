package com.jolly.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jolly.ai.Difficulty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Table rules and AI profiles, loaded from JSON.
 * The bundled {@code jolly.json} holds the standard values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JollyConfig {
    public static final String DEFAULT_RESOURCE = "jolly.json";

    @JsonProperty("starting_hand_size")
    private int startingHandSize = 13;

    @JsonProperty("other_hand_size")
    private int otherHandSize = 12;

    @JsonProperty("first_meld_min_points")
    private int firstMeldMinPoints = 30;

    @JsonProperty("zudrehen_bonus")
    private int zudrehenBonus = 30;

    @JsonProperty("win_threshold")
    private int winThreshold = 500;

    @JsonProperty("max_turns_per_round")
    private int maxTurnsPerRound = 400;

    @JsonProperty("max_rounds")
    private int maxRounds = 100;

    @JsonProperty("discard_row_visible")
    private int discardRowVisible = 5;

    @JsonProperty("difficulties")
    private Map<String, Difficulty> difficulties = new LinkedHashMap<>();

    public JollyConfig() {
        difficulties.put("easy", Difficulty.EASY);
        difficulties.put("medium", Difficulty.MEDIUM);
        difficulties.put("hard", Difficulty.HARD);
    }

    /**
     * Load the bundled configuration.
     */
    public static JollyConfig defaults() throws JollyConfigException {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a JSON file.
     */
    public static JollyConfig fromFile(String path) throws JollyConfigException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new JollyConfigException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     */
    public static JollyConfig fromResource(String resourcePath) throws JollyConfigException {
        try (InputStream is = JollyConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new JollyConfigException("Resource not found: " + resourcePath);
            }
            return validate(new ObjectMapper().readValue(is, JollyConfig.class));
        } catch (IOException e) {
            throw new JollyConfigException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a JSON string. Missing keys keep their standard values.
     */
    public static JollyConfig fromJson(String json) throws JollyConfigException {
        try {
            return validate(new ObjectMapper().readValue(json, JollyConfig.class));
        } catch (IOException e) {
            throw new JollyConfigException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static JollyConfig validate(JollyConfig config) throws JollyConfigException {
        if (config.startingHandSize < 1 || config.otherHandSize < 1) {
            throw new JollyConfigException("Hand sizes must be positive");
        }
        if (config.startingHandSize + config.otherHandSize >= 60) {
            throw new JollyConfigException("Hands would use up the whole deck");
        }
        if (config.winThreshold <= 0) {
            throw new JollyConfigException("win_threshold must be positive");
        }
        if (config.maxTurnsPerRound < 1 || config.maxRounds < 1) {
            throw new JollyConfigException("max_turns_per_round and max_rounds must be positive");
        }
        if (config.firstMeldMinPoints < 0 || config.zudrehenBonus < 0) {
            throw new JollyConfigException("first_meld_min_points and zudrehen_bonus cannot be negative");
        }
        if (config.discardRowVisible < 0) {
            throw new JollyConfigException("discard_row_visible cannot be negative");
        }
        return config;
    }

    /**
     * Look up a difficulty profile by key (case-insensitive).
     * @throws JollyConfigException if no profile has that key
     */
    public Difficulty getDifficulty(String key) throws JollyConfigException {
        Difficulty difficulty = difficulties.get(key.toLowerCase());
        if (difficulty == null) {
            throw new JollyConfigException("Unknown difficulty: " + key
                    + " (known: " + String.join(", ", difficulties.keySet()) + ")");
        }
        return difficulty;
    }

    public int getStartingHandSize() {
        return startingHandSize;
    }

    public int getOtherHandSize() {
        return otherHandSize;
    }

    public int getFirstMeldMinPoints() {
        return firstMeldMinPoints;
    }

    public int getZudrehenBonus() {
        return zudrehenBonus;
    }

    public int getWinThreshold() {
        return winThreshold;
    }

    public int getMaxTurnsPerRound() {
        return maxTurnsPerRound;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public int getDiscardRowVisible() {
        return discardRowVisible;
    }

    public Map<String, Difficulty> getDifficulties() {
        return Map.copyOf(difficulties);
    }

    public void setMaxTurnsPerRound(int maxTurnsPerRound) {
        this.maxTurnsPerRound = maxTurnsPerRound;
    }
}
