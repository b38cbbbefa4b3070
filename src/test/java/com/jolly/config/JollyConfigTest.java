package com.jolly.config;

import com.jolly.ai.Difficulty;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JollyConfig loading.
 */
class JollyConfigTest {

    @Test
    void testBundledDefaults() throws JollyConfigException {
        JollyConfig config = JollyConfig.defaults();

        assertEquals(13, config.getStartingHandSize());
        assertEquals(12, config.getOtherHandSize());
        assertEquals(30, config.getFirstMeldMinPoints());
        assertEquals(30, config.getZudrehenBonus());
        assertEquals(500, config.getWinThreshold());
        assertEquals(400, config.getMaxTurnsPerRound());
        assertEquals(100, config.getMaxRounds());
        assertEquals(5, config.getDiscardRowVisible());
        assertEquals(Difficulty.MEDIUM, config.getDifficulty("medium"));
        assertEquals(Difficulty.HARD, config.getDifficulty("Hard"));
    }

    @Test
    void testMissingKeysKeepStandardValues() throws JollyConfigException {
        JollyConfig config = JollyConfig.fromJson("{\"win_threshold\": 1000}");

        assertEquals(1000, config.getWinThreshold());
        assertEquals(13, config.getStartingHandSize());
        assertEquals(Difficulty.EASY, config.getDifficulty("easy"));
    }

    @Test
    void testUnknownKeysIgnored() throws JollyConfigException {
        JollyConfig config = JollyConfig.fromJson("{\"table_color\": \"green\"}");

        assertEquals(500, config.getWinThreshold());
    }

    @Test
    void testFromResource() throws JollyConfigException {
        JollyConfig config = JollyConfig.fromResource("quick-match.json");

        assertEquals(150, config.getWinThreshold());
        assertEquals(20, config.getMaxRounds());
        assertEquals(0.0, config.getDifficulty("perfect").errorRate());
        assertEquals(4, config.getDifficulties().size());
    }

    @Test
    void testFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("jolly.json");
        Files.writeString(file, "{\"zudrehen_bonus\": 50, \"first_meld_min_points\": 40}");

        JollyConfig config = JollyConfig.fromFile(file.toString());

        assertEquals(50, config.getZudrehenBonus());
        assertEquals(40, config.getFirstMeldMinPoints());
    }

    @Test
    void testMissingFile() {
        JollyConfigException e = assertThrows(JollyConfigException.class,
                () -> JollyConfig.fromFile("/nonexistent/jolly.json"));
        assertNotNull(e.getCause());
    }

    @Test
    void testMissingResource() {
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromResource("nope.json"));
    }

    @Test
    void testMalformedJson() {
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson("{ not json"));
    }

    @Test
    void testInvalidValues() {
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson("{\"starting_hand_size\": 0}"));
        assertThrows(JollyConfigException.class,
                () -> JollyConfig.fromJson("{\"starting_hand_size\": 30, \"other_hand_size\": 30}"));
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson("{\"win_threshold\": -5}"));
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson("{\"max_rounds\": 0}"));
    }

    @Test
    void testNegativeTableValues() {
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson("{\"discard_row_visible\": -1}"));
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson("{\"first_meld_min_points\": -10}"));
        assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson("{\"zudrehen_bonus\": -20}"));
        assertDoesNotThrow(() -> JollyConfig.fromJson("{\"discard_row_visible\": 0, \"first_meld_min_points\": 0}"));
    }

    @Test
    void testInvalidDifficultyProfile() {
        JollyConfigException e = assertThrows(JollyConfigException.class, () -> JollyConfig.fromJson(
                "{\"difficulties\": {\"odd\": {\"name\": \"Odd\", \"think_time_ms\": 0, \"error_rate\": 2.0, \"strategy_depth\": 1}}}"));
        assertTrue(e.getMessage().contains("JSON"));
    }

    @Test
    void testUnknownDifficulty() throws JollyConfigException {
        JollyConfig config = JollyConfig.defaults();

        JollyConfigException e = assertThrows(JollyConfigException.class, () -> config.getDifficulty("expert"));
        assertTrue(e.getMessage().contains("expert"));
    }
}
