package de.bsommerfeld.botradar.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import de.bsommerfeld.botradar.core.ConfigurationException;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Posting interval analyzer settings.
 */
public class IntervalConfig {

    @JsonProperty("interval-threshold-seconds")
    @JsonPropertyDescription("Mean gap below which an account is flagged, in seconds (default: 30)")
    private double intervalThresholdSeconds = 30.0;

    @JsonProperty("outlier-threshold-stddev")
    @JsonPropertyDescription("Standard deviations below the mean a single gap must fall to count as a burst (default: 2)")
    private double outlierThresholdStddev = 2.0;

    @JsonProperty("time-zone")
    @JsonPropertyDescription("Zone applied to timestamps without offset information (default: UTC)")
    private String timeZone = "UTC";

    public double getIntervalThresholdSeconds() {
        return intervalThresholdSeconds;
    }

    public void setIntervalThresholdSeconds(double intervalThresholdSeconds) {
        this.intervalThresholdSeconds = intervalThresholdSeconds;
    }

    public double getOutlierThresholdStddev() {
        return outlierThresholdStddev;
    }

    public void setOutlierThresholdStddev(double outlierThresholdStddev) {
        this.outlierThresholdStddev = outlierThresholdStddev;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    /**
     * Resolves {@link #getTimeZone()} to a {@link ZoneId}.
     *
     * @throws ConfigurationException if the id is missing or unknown
     */
    public ZoneId zoneId() {
        if (timeZone == null || timeZone.isBlank())
            throw new ConfigurationException("interval.time-zone must not be empty");
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("interval.time-zone is not a valid zone id: " + timeZone, e);
        }
    }

    public void validate() {
        ConfigChecks.requireNonNegative("interval.interval-threshold-seconds", intervalThresholdSeconds);
        ConfigChecks.requireNonNegative("interval.outlier-threshold-stddev", outlierThresholdStddev);
        zoneId();
    }
}
