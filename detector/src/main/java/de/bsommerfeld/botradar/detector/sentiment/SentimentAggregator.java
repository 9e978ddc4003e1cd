package de.bsommerfeld.botradar.detector.sentiment;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.botradar.core.InputFormatException;
import de.bsommerfeld.botradar.core.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Averages per-post polarity over a batch of posts.
 */
@Singleton
public class SentimentAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(SentimentAggregator.class);

    private final SentimentScorer scorer;

    @Inject
    public SentimentAggregator(SentimentScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Arithmetic mean of the polarity of every post; {@code 0.0} for an empty
     * batch.
     *
     * @throws ScoringException     if the scorer fails or returns a value outside
     *                              {@code [-1.0, 1.0]}
     * @throws InputFormatException if a post is {@code null}
     */
    public double averagePolarity(List<String> posts) {
        if (posts.isEmpty()) {
            LOG.info("No posts provided for sentiment analysis");
            return 0.0;
        }

        double sum = 0.0;
        for (int i = 0; i < posts.size(); i++) {
            sum += scoreChecked(i, posts.get(i));
        }
        double average = sum / posts.size();
        LOG.info("Sentiment analysis: average polarity {} over {} posts", String.format("%.3f", average),
                posts.size());
        return average;
    }

    private double scoreChecked(int index, String post) {
        if (post == null)
            throw new InputFormatException("Post at index " + index + " is null");

        double polarity;
        try {
            polarity = scorer.score(post);
        } catch (ScoringException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Sentiment scorer failed on post {}: {}", index, e.getMessage());
            throw new ScoringException("Sentiment scorer failed on post " + index, e);
        }

        if (Double.isNaN(polarity) || polarity < -1.0 || polarity > 1.0) {
            throw new ScoringException("Polarity " + polarity + " for post " + index
                    + " is outside [-1.0, 1.0]");
        }
        return polarity;
    }
}
