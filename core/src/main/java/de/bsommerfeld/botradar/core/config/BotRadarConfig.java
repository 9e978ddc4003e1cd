package de.bsommerfeld.botradar.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Root configuration. Each section belongs to exactly one detector and no
 * setting influences another section.
 */
public class BotRadarConfig {

    @JsonProperty("interval")
    @JsonPropertyDescription("Posting Interval Analyzer")
    private IntervalConfig interval = new IntervalConfig();

    @JsonProperty("phrases")
    @JsonPropertyDescription("Repeated Phrase Detector")
    private PhraseConfig phrases = new PhraseConfig();

    @JsonProperty("network")
    @JsonPropertyDescription("Connection Cluster Detector")
    private NetworkConfig network = new NetworkConfig();

    public IntervalConfig getInterval() {
        return interval;
    }

    public void setInterval(IntervalConfig interval) {
        this.interval = interval;
    }

    public PhraseConfig getPhrases() {
        return phrases;
    }

    public void setPhrases(PhraseConfig phrases) {
        this.phrases = phrases;
    }

    public NetworkConfig getNetwork() {
        return network;
    }

    public void setNetwork(NetworkConfig network) {
        this.network = network;
    }

    /**
     * Validates every section.
     *
     * @throws de.bsommerfeld.botradar.core.ConfigurationException on the first
     *                                                             invalid value
     */
    public void validate() {
        ConfigChecks.requireSection("interval", interval).validate();
        ConfigChecks.requireSection("phrases", phrases).validate();
        ConfigChecks.requireSection("network", network).validate();
    }
}
