package de.bsommerfeld.botradar.detector;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.botradar.core.BotRadarException;
import de.bsommerfeld.botradar.core.domain.AccountCluster;
import de.bsommerfeld.botradar.core.domain.ActivityDataset;
import de.bsommerfeld.botradar.core.domain.SuspicionReport;
import de.bsommerfeld.botradar.core.event.ApplicationEventBus;
import de.bsommerfeld.botradar.core.event.DetectionEvents;
import de.bsommerfeld.botradar.detector.interval.PostingIntervalAnalyzer;
import de.bsommerfeld.botradar.detector.network.ConnectionClusterDetector;
import de.bsommerfeld.botradar.detector.phrase.RepeatedPhraseDetector;
import de.bsommerfeld.botradar.detector.sentiment.SentimentAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs the four detectors over one {@link ActivityDataset} and merges their
 * output into a {@link SuspicionReport}. The detectors stay independent; this
 * class only sequences them and publishes the outcome on the event bus.
 */
@Singleton
public class SuspicionReportService {

    private static final Logger LOG = LoggerFactory.getLogger(SuspicionReportService.class);

    private final PostingIntervalAnalyzer intervalAnalyzer;
    private final RepeatedPhraseDetector phraseDetector;
    private final SentimentAggregator sentimentAggregator;
    private final ConnectionClusterDetector clusterDetector;
    private final ApplicationEventBus eventBus;

    @Inject
    public SuspicionReportService(PostingIntervalAnalyzer intervalAnalyzer,
            RepeatedPhraseDetector phraseDetector,
            SentimentAggregator sentimentAggregator,
            ConnectionClusterDetector clusterDetector,
            ApplicationEventBus eventBus) {
        this.intervalAnalyzer = intervalAnalyzer;
        this.phraseDetector = phraseDetector;
        this.sentimentAggregator = sentimentAggregator;
        this.clusterDetector = clusterDetector;
        this.eventBus = eventBus;
    }

    /**
     * Analyzes {@code dataset} with every detector.
     *
     * @throws BotRadarException the first detector failure, unchanged
     */
    public SuspicionReport analyze(ActivityDataset dataset) {
        List<String> accounts = run("interval", () -> intervalAnalyzer.detect(dataset.timelines()));
        List<String> phrases = run("phrases", () -> phraseDetector.detect(dataset.posts()));
        double sentiment = run("sentiment", () -> sentimentAggregator.averagePolarity(dataset.posts()));
        List<AccountCluster> clusters = run("network", () -> clusterDetector.detect(dataset.connections()));

        SuspicionReport report = new SuspicionReport(accounts, phrases, sentiment, clusters);
        LOG.info("Analysis complete: {} accounts, {} phrases, {} clusters flagged",
                accounts.size(), phrases.size(), clusters.size());

        eventBus.post(new DetectionEvents.ReportCompletedEvent(report, Instant.now()));
        return report;
    }

    private <T> T run(String detector, Supplier<T> step) {
        try {
            return step.get();
        } catch (BotRadarException e) {
            LOG.error("Detector '{}' failed: {}", detector, e.getMessage());
            eventBus.post(new DetectionEvents.AnalysisFailedEvent(detector, e.getMessage()));
            throw e;
        }
    }
}
