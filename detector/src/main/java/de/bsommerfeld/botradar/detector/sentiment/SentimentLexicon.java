package de.bsommerfeld.botradar.detector.sentiment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Word lists backing {@link LexiconSentimentScorer}, read from a
 * tab-separated classpath resource.
 *
 * <pre>
 * # kind        word      value
 * word          great     0.8
 * intensifier   very      1.3
 * negator       not
 * </pre>
 *
 * Blank lines and lines starting with {@code #} are ignored. Words are stored
 * lowercased.
 */
final class SentimentLexicon {

    static final String DEFAULT_RESOURCE = "sentiment/lexicon.tsv";

    private final Map<String, Double> polarities;
    private final Map<String, Double> intensifiers;
    private final Set<String> negators;

    SentimentLexicon(Map<String, Double> polarities, Map<String, Double> intensifiers, Set<String> negators) {
        this.polarities = Collections.unmodifiableMap(new HashMap<>(polarities));
        this.intensifiers = Collections.unmodifiableMap(new HashMap<>(intensifiers));
        this.negators = Collections.unmodifiableSet(new HashSet<>(negators));
    }

    /**
     * Reads the lexicon at {@code resource} from the classpath.
     *
     * @throws IllegalStateException if the resource is missing or a line is
     *                               malformed
     */
    static SentimentLexicon load(String resource) {
        try (InputStream in = SentimentLexicon.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("Sentiment lexicon not found: " + resource);
            return parse(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sentiment lexicon: " + resource, e);
        }
    }

    private static SentimentLexicon parse(BufferedReader reader, String resource) throws IOException {
        Map<String, Double> polarities = new HashMap<>();
        Map<String, Double> intensifiers = new HashMap<>();
        Set<String> negators = new HashSet<>();

        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#"))
                continue;

            String[] cols = trimmed.split("\\s+");
            String word = cols.length > 1 ? cols[1].toLowerCase(Locale.ROOT) : null;
            switch (cols[0]) {
                case "word" -> polarities.put(word, value(cols, resource, lineNo));
                case "intensifier" -> intensifiers.put(word, value(cols, resource, lineNo));
                case "negator" -> {
                    if (word == null)
                        throw malformed(resource, lineNo);
                    negators.add(word);
                }
                default -> throw malformed(resource, lineNo);
            }
        }
        return new SentimentLexicon(polarities, intensifiers, negators);
    }

    private static double value(String[] cols, String resource, int lineNo) {
        if (cols.length != 3)
            throw malformed(resource, lineNo);
        try {
            return Double.parseDouble(cols[2]);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(resource + ":" + lineNo + " has a non-numeric value", e);
        }
    }

    private static IllegalStateException malformed(String resource, int lineNo) {
        return new IllegalStateException("Malformed lexicon entry at " + resource + ":" + lineNo);
    }

    Double polarity(String word) {
        return polarities.get(word);
    }

    Double intensity(String word) {
        return intensifiers.get(word);
    }

    boolean isNegator(String word) {
        return negators.contains(word);
    }

    int size() {
        return polarities.size();
    }
}
