package de.bsommerfeld.botradar.detector.sentiment;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Default {@link SentimentScorer}: averages the polarity of lexicon words in a
 * text.
 *
 * <p>
 * A negator ("not", "never", ...) directly before a sentiment word inverts and
 * halves it; an intensifier ("very", "really", ...) multiplies it by its
 * factor. Modifiers only apply to the next word. Texts without a single
 * lexicon word are neutral.
 */
@Singleton
public class LexiconSentimentScorer implements SentimentScorer {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}']+");
    private static final double NEGATION_FACTOR = -0.5;

    private final SentimentLexicon lexicon;

    @Inject
    public LexiconSentimentScorer() {
        this(SentimentLexicon.load(SentimentLexicon.DEFAULT_RESOURCE));
    }

    LexiconSentimentScorer(SentimentLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public double score(String text) {
        double sum = 0.0;
        int matches = 0;
        boolean negate = false;
        double intensity = 1.0;

        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty())
                continue;

            if (lexicon.isNegator(token)) {
                negate = true;
                continue;
            }
            Double factor = lexicon.intensity(token);
            if (factor != null) {
                intensity *= factor;
                continue;
            }

            Double polarity = lexicon.polarity(token);
            if (polarity != null) {
                double value = polarity * intensity;
                if (negate)
                    value *= NEGATION_FACTOR;
                sum += clamp(value);
                matches++;
            }
            negate = false;
            intensity = 1.0;
        }

        return matches == 0 ? 0.0 : clamp(sum / matches);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
