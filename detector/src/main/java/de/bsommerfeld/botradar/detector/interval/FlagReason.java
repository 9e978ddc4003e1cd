package de.bsommerfeld.botradar.detector.interval;

/**
 * Why the interval analyzer flagged an account.
 */
public enum FlagReason {

    /** The mean gap is below the configured interval threshold. */
    MEAN_BELOW_THRESHOLD,

    /** A single gap lies more than the configured number of standard deviations below the mean. */
    BURST_OUTLIER
}
