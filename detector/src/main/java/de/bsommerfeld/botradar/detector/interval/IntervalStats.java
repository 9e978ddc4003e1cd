package de.bsommerfeld.botradar.detector.interval;

/**
 * Descriptive statistics over one account's consecutive posting gaps.
 * All values are in seconds.
 *
 * @param gapCount      number of gaps (timestamps minus one)
 * @param meanSeconds   arithmetic mean gap
 * @param stdDevSeconds population standard deviation of the gaps
 * @param minSeconds    shortest gap
 * @param maxSeconds    longest gap
 */
public record IntervalStats(
        int gapCount,
        double meanSeconds,
        double stdDevSeconds,
        double minSeconds,
        double maxSeconds) {

    /**
     * Computes the statistics of {@code gaps}.
     *
     * @throws IllegalArgumentException if {@code gaps} is empty
     */
    public static IntervalStats of(double[] gaps) {
        if (gaps.length == 0)
            throw new IllegalArgumentException("At least one gap is required");

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double gap : gaps) {
            sum += gap;
            min = Math.min(min, gap);
            max = Math.max(max, gap);
        }
        // uniform gaps: exact mean and zero deviation, free of summation rounding
        if (min == max)
            return new IntervalStats(gaps.length, min, 0.0, min, max);

        double mean = sum / gaps.length;

        double squares = 0;
        for (double gap : gaps) {
            double d = gap - mean;
            squares += d * d;
        }
        double stdDev = Math.sqrt(squares / gaps.length);

        return new IntervalStats(gaps.length, mean, stdDev, min, max);
    }

    /**
     * Lower bound below which a gap counts as a burst for this account, or
     * {@link Double#NEGATIVE_INFINITY} when the gaps are perfectly uniform and no
     * gap can be an outlier.
     */
    public double burstCutoff(double stddevMultiplier) {
        if (stdDevSeconds == 0)
            return Double.NEGATIVE_INFINITY;
        return meanSeconds - stddevMultiplier * stdDevSeconds;
    }
}
