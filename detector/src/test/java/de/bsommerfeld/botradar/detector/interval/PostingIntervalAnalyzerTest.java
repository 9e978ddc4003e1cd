package de.bsommerfeld.botradar.detector.interval;

import de.bsommerfeld.botradar.core.ConfigurationException;
import de.bsommerfeld.botradar.core.InputFormatException;
import de.bsommerfeld.botradar.core.config.IntervalConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PostingIntervalAnalyzerTest {

    private static final Instant START = Instant.parse("2025-03-09T12:00:00Z");

    @Test
    void detect_shouldNeverFlagAccountsWithFewerThanTwoTimestamps() {
        Map<String, List<String>> timelines = new LinkedHashMap<>();
        timelines.put("empty", List.of());
        timelines.put("single", List.of("2025-03-09 12:00:00"));
        timelines.put("missing", null);

        assertTrue(analyzer(30, 2).detect(timelines).isEmpty());
    }

    @Test
    void detect_shouldFlagConstantFastCadence() {
        var timelines = Map.of("bot", timeline(4, 4, 4, 4, 4));

        assertEquals(List.of("bot"), analyzer(30, 2).detect(timelines));
    }

    @Test
    void detect_shouldNotFlagConstantSlowCadence() {
        var timelines = Map.of("human", timeline(60, 60, 60, 60));

        assertTrue(analyzer(30, 2).detect(timelines).isEmpty());
    }

    @Test
    void detect_shouldNotFlagMeanExactlyAtThreshold() {
        var timelines = Map.of("edge", timeline(30, 30, 30));

        assertTrue(analyzer(30, 2).detect(timelines).isEmpty());
    }

    @Test
    void detect_shouldFlagSingleBurstViaOutlierRule() {
        // mean gap 450s is far above the interval threshold
        var timelines = Map.of("burst", timeline(600, 600, 600, 1));

        List<AccountVerdict> verdicts = analyzer(30, 1).evaluate(timelines);

        assertEquals(1, verdicts.size());
        assertTrue(verdicts.get(0).flaggedBy(FlagReason.BURST_OUTLIER));
        assertFalse(verdicts.get(0).flaggedBy(FlagReason.MEAN_BELOW_THRESHOLD));
    }

    @Test
    void detect_shouldFlagBurstWithDefaultMultiplierGivenEnoughHistory() {
        var timelines = Map.of("burst", timeline(600, 600, 600, 600, 600, 600, 600, 600, 600, 1));

        assertEquals(List.of("burst"), analyzer(30, 2).detect(timelines));
    }

    @Test
    void detect_shouldNotFlagShortHistoryBurstBeyondReachableDeviation() {
        // With four gaps one value can sit at most 1.5 population deviations from
        // the mean, so a 2-sigma rule cannot fire
        var timelines = Map.of("burst", timeline(600, 600, 600, 1));

        assertTrue(analyzer(30, 2).detect(timelines).isEmpty());
    }

    @Test
    void detect_shouldIgnoreOutlierRuleForUniformGaps() {
        // stddev is zero, so even a zero multiplier cannot flag anything
        var timelines = Map.of("metronome", timeline(120, 120, 120, 120));

        assertTrue(analyzer(30, 0).detect(timelines).isEmpty());
    }

    @Test
    void detectInstants_shouldIgnoreOutlierRuleForUniformSubSecondGaps() {
        var analyzer = analyzer(0, 0.5);

        for (int millis = 1; millis < 1000; millis++) {
            for (int gapCount = 1; gapCount <= 11; gapCount++) {
                List<Instant> timestamps = new ArrayList<>();
                Instant t = START;
                timestamps.add(t);
                for (int i = 0; i < gapCount; i++) {
                    t = t.plusMillis(millis);
                    timestamps.add(t);
                }

                List<String> flagged = analyzer.detectInstants(Map.of("ticker", timestamps));
                assertTrue(flagged.isEmpty(), millis + "ms x" + gapCount);
            }
        }
    }

    @Test
    void detect_shouldSortTimestampsBeforeComputingGaps() {
        List<String> shuffled = new ArrayList<>(timeline(4, 4, 4, 4));
        Collections.reverse(shuffled);
        List<String> snapshot = List.copyOf(shuffled);

        var verdicts = analyzer(30, 2).evaluate(Map.of("bot", shuffled));

        assertEquals(1, verdicts.size());
        assertEquals(4.0, verdicts.get(0).stats().meanSeconds(), 1e-9);
        assertEquals(snapshot, shuffled, "Caller list must not be reordered");
    }

    @Test
    void detect_shouldListAccountOnceWhenBothRulesFire() {
        // mean below threshold and a gap far below the mean
        var timelines = Map.of("bot", timeline(20, 20, 20, 20, 20, 20, 20, 20, 20, 0));

        List<AccountVerdict> verdicts = analyzer(30, 2).evaluate(timelines);

        assertEquals(1, verdicts.size());
        assertTrue(verdicts.get(0).flaggedBy(FlagReason.MEAN_BELOW_THRESHOLD));
        assertTrue(verdicts.get(0).flaggedBy(FlagReason.BURST_OUTLIER));
        assertEquals(List.of("bot"), analyzer(30, 2).detect(timelines));
    }

    @Test
    void detect_shouldPreserveInputOrder() {
        Map<String, List<String>> timelines = new LinkedHashMap<>();
        timelines.put("zeta", timeline(1, 1));
        timelines.put("human", timeline(3600, 3600));
        timelines.put("alpha", timeline(2, 2));

        assertEquals(List.of("zeta", "alpha"), analyzer(30, 2).detect(timelines));
    }

    @Test
    void detect_shouldAcceptMixedTimestampFormats() {
        var timelines = Map.of("bot", List.of(
                "2025-03-09 12:00:01", "2025/03/09 12:00:05", "2025-03-09T12:00:09Z", "1741521613"));

        assertEquals(List.of("bot"), analyzer(30, 2).detect(timelines));
    }

    @Test
    void detect_shouldFailOnUnparsableTimestamp() {
        var timelines = Map.of("bot", List.of("2025-03-09 12:00:01", "soon"));

        var e = assertThrows(InputFormatException.class, () -> analyzer(30, 2).detect(timelines));
        assertEquals("bot", e.getAccountId());
        assertEquals("soon", e.getValue());
    }

    @Test
    void detect_shouldRejectNullAccountId() {
        Map<String, List<String>> timelines = new HashMap<>();
        timelines.put(null, timeline(1, 1));

        assertThrows(InputFormatException.class, () -> analyzer(30, 2).detect(timelines));
    }

    @Test
    void detect_shouldReturnEmptyForNoAccounts() {
        assertTrue(analyzer(30, 2).detect(Map.of()).isEmpty());
    }

    @Test
    void detect_shouldBeIdempotent() {
        Map<String, List<String>> timelines = new LinkedHashMap<>();
        timelines.put("bot", timeline(4, 4, 4));
        timelines.put("burst", timeline(600, 600, 600, 600, 600, 600, 600, 600, 600, 1));
        timelines.put("human", timeline(900, 1200));
        var analyzer = analyzer(30, 2);

        assertEquals(analyzer.detect(timelines), analyzer.detect(timelines));
    }

    @Test
    void detectInstants_shouldWorkOnParsedTimestamps() {
        var timelines = Map.of("bot", List.of(START.plusSeconds(10), START, START.plusSeconds(5)));

        assertEquals(List.of("bot"), analyzer(30, 2).detectInstants(timelines));
    }

    @Test
    void detectInstants_shouldRejectNullTimestamp() {
        List<Instant> withNull = new ArrayList<>();
        withNull.add(START);
        withNull.add(null);

        assertThrows(InputFormatException.class,
                () -> analyzer(30, 2).detectInstants(Map.of("bot", withNull)));
    }

    @Test
    void gaps_shouldKeepSubSecondPrecision() {
        double[] gaps = PostingIntervalAnalyzer.gaps(List.of(START, START.plusMillis(1500)));

        assertArrayEquals(new double[] { 1.5 }, gaps, 1e-9);
    }

    @Test
    void constructor_shouldRejectInvalidConfig() {
        var config = new IntervalConfig();
        config.setOutlierThresholdStddev(-2);

        assertThrows(ConfigurationException.class, () -> new PostingIntervalAnalyzer(config));
    }

    private static PostingIntervalAnalyzer analyzer(double intervalThreshold, double stddev) {
        var config = new IntervalConfig();
        config.setIntervalThresholdSeconds(intervalThreshold);
        config.setOutlierThresholdStddev(stddev);
        return new PostingIntervalAnalyzer(config);
    }

    /**
     * ISO timestamps starting at {@link #START} separated by the given gaps.
     */
    private static List<String> timeline(long... gaps) {
        List<String> out = new ArrayList<>();
        Instant t = START;
        out.add(t.toString());
        for (long gap : gaps) {
            t = t.plusSeconds(gap);
            out.add(t.toString());
        }
        return out;
    }
}
