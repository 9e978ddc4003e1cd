package de.bsommerfeld.botradar.terminal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.botradar.core.InputFormatException;
import de.bsommerfeld.botradar.core.domain.ActivityDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an {@link ActivityDataset} from JSON:
 *
 * <pre>
 * {
 *   "timelines":   { "bot1": ["2025-03-09 12:00:01", "2025-03-09 12:00:05"] },
 *   "posts":       ["Buy now!", "Buy now!"],
 *   "connections": { "bot1": ["bot2"], "bot2": [] }
 * }
 * </pre>
 *
 * Every section is optional.
 */
public final class DatasetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetLoader.class);

    static final String SAMPLE_RESOURCE = "sample-dataset.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private DatasetLoader() {
    }

    /**
     * @throws InputFormatException if the file cannot be read or is not a valid
     *                              dataset
     */
    public static ActivityDataset load(Path path) {
        LOG.info("Loading dataset from: {}", path.toAbsolutePath());
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new InputFormatException("Failed to read dataset file: " + path, e);
        }
    }

    /**
     * Bundled demo data: two fast-posting bots, one human with a single burst
     * of activity, a copy-paste campaign and a small follower ring.
     */
    public static ActivityDataset loadSample() {
        try (InputStream in = DatasetLoader.class.getClassLoader().getResourceAsStream(SAMPLE_RESOURCE)) {
            if (in == null)
                throw new IllegalStateException("Sample dataset not found: " + SAMPLE_RESOURCE);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sample dataset", e);
        }
    }

    public static ActivityDataset parse(String json) {
        try {
            ActivityDataset dataset = MAPPER.readValue(json, ActivityDataset.class);
            return dataset != null ? dataset : ActivityDataset.empty();
        } catch (JsonProcessingException e) {
            throw new InputFormatException("Invalid dataset: " + e.getOriginalMessage(), e);
        }
    }
}
