package de.bsommerfeld.botradar.detector.phrase;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.botradar.core.InputFormatException;
import de.bsommerfeld.botradar.core.config.PhraseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Finds post texts that recur verbatim across a batch, a typical sign of
 * copy-paste campaigns.
 *
 * <p>
 * A "phrase" is a whole post after cleaning, not a substring: characters
 * matched by the cleaning pattern are removed, surrounding whitespace is
 * trimmed and, when configured case-insensitive, the text is lowercased.
 * Interior whitespace is compared exactly. Posts that clean down to nothing are
 * ignored. Phrases are returned in the order they were first seen.
 */
@Singleton
public class RepeatedPhraseDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RepeatedPhraseDetector.class);

    private final int repetitionThreshold;
    private final Pattern cleaningPattern;
    private final boolean caseSensitive;

    @Inject
    public RepeatedPhraseDetector(PhraseConfig config) {
        config.validate();
        this.repetitionThreshold = config.getRepetitionThreshold();
        this.cleaningPattern = config.cleaningPattern();
        this.caseSensitive = config.isCaseSensitive();
    }

    /**
     * Returns every distinct cleaned phrase occurring at least
     * {@code repetitionThreshold} times.
     *
     * @throws InputFormatException if a post is {@code null}
     */
    public List<String> detect(List<String> posts) {
        Map<String, Integer> counts = countPhrases(posts);
        List<String> repeated = counts.entrySet().stream()
                .filter(e -> e.getValue() >= repetitionThreshold)
                .map(Map.Entry::getKey)
                .toList();
        LOG.info("Phrase analysis: {} repeated phrases in {} posts", repeated.size(), posts.size());
        return repeated;
    }

    /**
     * Frequency table of cleaned phrases in first-seen order.
     */
    public Map<String, Integer> countPhrases(List<String> posts) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int index = 0;
        for (String post : posts) {
            if (post == null)
                throw new InputFormatException("Post at index " + index + " is null");
            String phrase = clean(post);
            if (!phrase.isEmpty())
                counts.merge(phrase, 1, Integer::sum);
            index++;
        }
        return counts;
    }

    /**
     * Applies the cleaning pattern and case policy to a single post.
     */
    public String clean(String post) {
        String cleaned = cleaningPattern.matcher(post).replaceAll("").strip();
        return caseSensitive ? cleaned : cleaned.toLowerCase(Locale.ROOT);
    }
}
