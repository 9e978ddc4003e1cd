package de.bsommerfeld.botradar.detector.sentiment;

/**
 * Scores the polarity of a single text.
 *
 * <p>
 * Implementations return a value in {@code [-1.0, 1.0]}: negative for negative
 * tone, positive for positive tone, {@code 0.0} for neutral. They must be
 * stateless with respect to previous calls. Failures are reported by throwing;
 * an implementation must never return {@code 0.0} to hide an error.
 */
@FunctionalInterface
public interface SentimentScorer {

    double score(String text);
}
