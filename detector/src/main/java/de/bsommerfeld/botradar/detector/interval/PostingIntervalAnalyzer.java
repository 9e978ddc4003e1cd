package de.bsommerfeld.botradar.detector.interval;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.botradar.core.InputFormatException;
import de.bsommerfeld.botradar.core.config.IntervalConfig;
import de.bsommerfeld.botradar.core.time.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flags accounts whose posting cadence looks automated.
 *
 * <p>
 * For every account with at least two timestamps the timestamps are sorted
 * and the consecutive gaps computed. An account is flagged when
 * <ol>
 * <li>its mean gap is below the interval threshold, or</li>
 * <li>any single gap lies more than {@code outlierThresholdStddev} population
 * standard deviations below its mean gap.</li>
 * </ol>
 * Accounts with fewer than two timestamps carry no cadence and are skipped.
 * Caller collections are never modified; the result keeps input order and
 * lists each account once.
 */
@Singleton
public class PostingIntervalAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PostingIntervalAnalyzer.class);

    private final double intervalThresholdSeconds;
    private final double outlierThresholdStddev;
    private final TimestampParser parser;

    @Inject
    public PostingIntervalAnalyzer(IntervalConfig config) {
        config.validate();
        this.intervalThresholdSeconds = config.getIntervalThresholdSeconds();
        this.outlierThresholdStddev = config.getOutlierThresholdStddev();
        this.parser = new TimestampParser(config.zoneId());
    }

    /**
     * Parses raw timestamps and returns the suspicious account ids.
     *
     * @throws InputFormatException if an account id is null or a timestamp
     *                              cannot be parsed
     */
    public List<String> detect(Map<String, List<String>> timelines) {
        return ids(evaluate(timelines));
    }

    /**
     * Same as {@link #detect(Map)} for already parsed timestamps.
     */
    public List<String> detectInstants(Map<String, List<Instant>> timelines) {
        return ids(evaluateInstants(timelines));
    }

    /**
     * Parses raw timestamps and returns a verdict for every flagged account.
     */
    public List<AccountVerdict> evaluate(Map<String, List<String>> timelines) {
        Map<String, List<Instant>> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : timelines.entrySet()) {
            String account = requireAccount(entry.getKey());
            List<String> raw = entry.getValue();
            parsed.put(account, raw == null ? List.of() : parser.parseAll(account, raw));
        }
        return evaluateInstants(parsed);
    }

    /**
     * Returns a verdict for every flagged account of already parsed timelines.
     */
    public List<AccountVerdict> evaluateInstants(Map<String, List<Instant>> timelines) {
        List<AccountVerdict> verdicts = new ArrayList<>();
        for (Map.Entry<String, List<Instant>> entry : timelines.entrySet()) {
            String account = requireAccount(entry.getKey());
            List<Instant> timestamps = entry.getValue();
            if (timestamps == null || timestamps.size() < 2)
                continue;
            for (Instant ts : timestamps) {
                if (ts == null)
                    throw new InputFormatException("Null timestamp for account '" + account + "'",
                            account, null, null);
            }

            AccountVerdict verdict = evaluateAccount(account, timestamps);
            if (verdict != null)
                verdicts.add(verdict);
        }
        LOG.info("Interval analysis: {} of {} accounts flagged", verdicts.size(), timelines.size());
        return verdicts;
    }

    /**
     * Consecutive gaps in seconds between the sorted timestamps.
     */
    public static double[] gaps(List<Instant> timestamps) {
        List<Instant> sorted = new ArrayList<>(timestamps);
        sorted.sort(null);

        double[] gaps = new double[sorted.size() - 1];
        for (int i = 1; i < sorted.size(); i++) {
            Duration d = Duration.between(sorted.get(i - 1), sorted.get(i));
            gaps[i - 1] = d.getSeconds() + d.getNano() / 1_000_000_000.0;
        }
        return gaps;
    }

    private AccountVerdict evaluateAccount(String account, List<Instant> timestamps) {
        double[] gaps = gaps(timestamps);
        IntervalStats stats = IntervalStats.of(gaps);
        Set<FlagReason> reasons = EnumSet.noneOf(FlagReason.class);

        if (stats.meanSeconds() < intervalThresholdSeconds)
            reasons.add(FlagReason.MEAN_BELOW_THRESHOLD);

        double cutoff = stats.burstCutoff(outlierThresholdStddev);
        for (double gap : gaps) {
            if (gap < cutoff) {
                reasons.add(FlagReason.BURST_OUTLIER);
                break;
            }
        }

        if (reasons.isEmpty())
            return null;

        LOG.debug("Flagged '{}' ({}): mean={}s, stddev={}s, min={}s", account, reasons,
                stats.meanSeconds(), stats.stdDevSeconds(), stats.minSeconds());
        return new AccountVerdict(account, stats, reasons);
    }

    private static String requireAccount(String account) {
        if (account == null || account.isEmpty())
            throw new InputFormatException("Account identifier must be a non-empty string");
        return account;
    }

    private static List<String> ids(List<AccountVerdict> verdicts) {
        return verdicts.stream().map(AccountVerdict::accountId).toList();
    }
}
