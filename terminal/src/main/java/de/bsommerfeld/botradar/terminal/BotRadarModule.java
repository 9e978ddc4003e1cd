package de.bsommerfeld.botradar.terminal;

import com.google.inject.AbstractModule;
import de.bsommerfeld.botradar.core.config.BotRadarConfig;
import de.bsommerfeld.botradar.core.config.IntervalConfig;
import de.bsommerfeld.botradar.core.config.NetworkConfig;
import de.bsommerfeld.botradar.core.config.PhraseConfig;
import de.bsommerfeld.botradar.detector.sentiment.LexiconSentimentScorer;
import de.bsommerfeld.botradar.detector.sentiment.SentimentScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring configuration and detectors for a terminal run.
 */
public class BotRadarModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(BotRadarModule.class);

    private final BotRadarConfig config;

    public BotRadarModule(BotRadarConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        config.validate();
        LOG.debug("Binding configuration (graph backend: {})", config.getNetwork().getBackend());

        bind(BotRadarConfig.class).toInstance(config);

        // Each detector only sees its own section
        bind(IntervalConfig.class).toInstance(config.getInterval());
        bind(PhraseConfig.class).toInstance(config.getPhrases());
        bind(NetworkConfig.class).toInstance(config.getNetwork());

        bind(SentimentScorer.class).to(LexiconSentimentScorer.class);
    }
}
