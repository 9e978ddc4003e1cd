package de.bsommerfeld.botradar.terminal;

import de.bsommerfeld.botradar.core.InputFormatException;
import de.bsommerfeld.botradar.core.domain.ActivityDataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatasetLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void parse_shouldReadAllSections() {
        ActivityDataset dataset = DatasetLoader.parse("""
                {
                  "timelines": { "bot1": ["2025-03-09 12:00:01", "2025-03-09 12:00:05"] },
                  "posts": ["Buy now!", ""],
                  "connections": { "a": ["b"], "c": [] }
                }
                """);

        assertEquals(List.of("2025-03-09 12:00:01", "2025-03-09 12:00:05"), dataset.timelines().get("bot1"));
        assertEquals(List.of("Buy now!", ""), dataset.posts());
        assertEquals(List.of(), dataset.connections().get("c"));
    }

    @Test
    void parse_shouldTreatMissingSectionsAsEmpty() {
        ActivityDataset dataset = DatasetLoader.parse("{ \"posts\": [\"hi\"] }");

        assertTrue(dataset.timelines().isEmpty());
        assertTrue(dataset.connections().isEmpty());
        assertEquals(1, dataset.posts().size());
    }

    @Test
    void parse_shouldRejectMalformedJson() {
        assertThrows(InputFormatException.class, () -> DatasetLoader.parse("{ \"posts\": [ "));
    }

    @Test
    void parse_shouldRejectUnknownSection() {
        assertThrows(InputFormatException.class, () -> DatasetLoader.parse("{ \"followers\": {} }"));
    }

    @Test
    void load_shouldReadFile() throws IOException {
        Path file = tempDir.resolve("dataset.json");
        Files.writeString(file, "{ \"connections\": { \"x\": [\"y\"] } }");

        assertEquals(List.of("y"), DatasetLoader.load(file).connections().get("x"));
    }

    @Test
    void load_shouldFailForMissingFile() {
        assertThrows(InputFormatException.class, () -> DatasetLoader.load(tempDir.resolve("missing.json")));
    }

    @Test
    void loadSample_shouldContainAllSections() {
        ActivityDataset sample = DatasetLoader.loadSample();

        assertTrue(sample.timelines().containsKey("bot1"));
        assertTrue(sample.timelines().containsKey("human"));
        assertFalse(sample.posts().isEmpty());
        assertTrue(sample.connections().size() > 20);
    }
}
