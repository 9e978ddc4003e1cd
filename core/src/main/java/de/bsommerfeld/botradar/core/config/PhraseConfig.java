package de.bsommerfeld.botradar.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import de.bsommerfeld.botradar.core.ConfigurationException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Repeated phrase detector settings. The cleaning regex describes the
 * characters to REMOVE; everything it does not match is kept.
 */
public class PhraseConfig {

    public static final String DEFAULT_CLEANING_REGEX = "[^a-zA-Z0-9\\s]";

    @JsonProperty("repetition-threshold")
    @JsonPropertyDescription("Minimum number of identical cleaned posts to report a phrase (default: 5)")
    private int repetitionThreshold = 5;

    @JsonProperty("cleaning-regex")
    @JsonPropertyDescription("Characters matching this pattern are stripped before comparison (default: [^a-zA-Z0-9\\s])")
    private String cleaningRegex = DEFAULT_CLEANING_REGEX;

    @JsonProperty("case-sensitive")
    @JsonPropertyDescription("Compare phrases case-sensitively; false lowercases before counting (default: true)")
    private boolean caseSensitive = true;

    public int getRepetitionThreshold() {
        return repetitionThreshold;
    }

    public void setRepetitionThreshold(int repetitionThreshold) {
        this.repetitionThreshold = repetitionThreshold;
    }

    public String getCleaningRegex() {
        return cleaningRegex;
    }

    public void setCleaningRegex(String cleaningRegex) {
        this.cleaningRegex = cleaningRegex;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    /**
     * Compiles {@link #getCleaningRegex()}.
     *
     * @throws ConfigurationException if the pattern is missing or malformed
     */
    public Pattern cleaningPattern() {
        if (cleaningRegex == null)
            throw new ConfigurationException("phrases.cleaning-regex must not be null");
        try {
            return Pattern.compile(cleaningRegex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("phrases.cleaning-regex is not a valid pattern: " + cleaningRegex, e);
        }
    }

    public void validate() {
        ConfigChecks.requirePositive("phrases.repetition-threshold", repetitionThreshold);
        cleaningPattern();
    }
}
