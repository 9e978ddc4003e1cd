package de.bsommerfeld.botradar.core.domain;

import java.util.List;

/**
 * Merged output of the four detectors for one {@link ActivityDataset}.
 *
 * @param suspiciousAccounts accounts flagged for abnormal posting cadence
 * @param repeatedPhrases    cleaned post texts repeated at least the configured
 *                           number of times
 * @param averageSentiment   mean polarity in {@code [-1.0, 1.0]}, 0.0 without
 *                           posts
 * @param suspiciousClusters connection clusters at or above the size threshold
 */
public record SuspicionReport(
        List<String> suspiciousAccounts,
        List<String> repeatedPhrases,
        double averageSentiment,
        List<AccountCluster> suspiciousClusters) {

    public SuspicionReport {
        suspiciousAccounts = List.copyOf(suspiciousAccounts);
        repeatedPhrases = List.copyOf(repeatedPhrases);
        suspiciousClusters = List.copyOf(suspiciousClusters);
    }

    /**
     * @return {@code true} if any detector produced a flag
     */
    public boolean hasFindings() {
        return !suspiciousAccounts.isEmpty()
                || !repeatedPhrases.isEmpty()
                || !suspiciousClusters.isEmpty();
    }
}
