package com.ipd;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
    @TempDir
    Path directory;

    @Test
    void playsTransformedMatch() throws IOException {
        Path output = directory.resolve("match.txt");
        int exitCode = Main.execute("--player", "Cooperator", "-t", "initial:DD", "-t", "flip", "-t", "track",
            "--opponent", "Defector", "--turns", "4", "-O", output.toString());

        assertEquals(0, exitCode);
        List<String> lines = Files.readAllLines(output);
        assertEquals(List.of(
            "HistoryTracking Flipped Cooperator [HistoryTrackingFlippedCooperator]: CCDD",
            "  tracked: CCDD",
            "Defector [Defector]: DDDD"), lines);
    }

    @Test
    void readsMatchFromConfig() throws IOException {
        Path config = directory.resolve("match.json");
        Files.writeString(config, """
            { "turns": 3, "length": "unknown",
              "player": { "strategy": "TitForTat", "transformers": ["final:D"] },
              "opponent": { "strategy": "Defector", "transformers": ["forgiver:1"] } }
            """);
        Path output = directory.resolve("match.txt");

        assertEquals(0, Main.execute("--config", config.toString(), "-O", output.toString()));
        assertEquals(List.of(
            "Tit For Tat [TitForTat]: CCC",
            "Forgiving Defector [ForgivingDefector]: CCC"), Files.readAllLines(output));
    }

    @Test
    void listsStrategies() throws IOException {
        Path output = directory.resolve("list.txt");
        assertEquals(0, Main.execute("--list", "-O", output.toString()));
        assertTrue(Files.readAllLines(output).contains("TitForTat (Tit For Tat)"));
    }

    @Test
    void failsOnUnknownStrategy() {
        Path output = directory.resolve("match.txt");
        assertNotEquals(0, Main.execute("--player", "Nobody", "-O", output.toString()));
    }
}
