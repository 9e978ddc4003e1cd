package de.bsommerfeld.botradar.core.event;

import de.bsommerfeld.botradar.core.domain.SuspicionReport;

import java.time.Instant;

/**
 * Events published once an analysis run has finished.
 */
public class DetectionEvents {

    /**
     * Fired after all four detectors completed on a dataset.
     */
    public record ReportCompletedEvent(SuspicionReport report, Instant completedAt) {
    }

    /**
     * Fired when an analysis run aborted. The cause is rethrown to the caller
     * as well; this event only informs passive listeners.
     */
    public record AnalysisFailedEvent(String detector, String message) {
    }
}
