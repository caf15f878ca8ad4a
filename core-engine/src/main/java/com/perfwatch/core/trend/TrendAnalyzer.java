package com.perfwatch.core.trend;

import com.perfwatch.core.model.ScoreSnapshot;
import com.perfwatch.core.model.TrendDirection;
import com.perfwatch.core.model.TrendEvent;
import com.perfwatch.core.model.TrendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Least-squares trend over a sliding window of composite scores.
 *
 * <h3>Window</h3>
 * <p>
 * Each entity keeps its last {@code windowSize} scores. The regression uses
 * the window index {@code 0..n-1} as x, so the slope is "score change per
 * monitoring cycle".
 * </p>
 *
 * <h3>Classification</h3>
 * <ul>
 * <li>fewer than {@value #MIN_POINTS} points: {@code STABLE}, confidence 0</li>
 * <li>slope above {@value #SLOPE_THRESHOLD}: {@code IMPROVING}</li>
 * <li>slope below -{@value #SLOPE_THRESHOLD}: {@code DECLINING}</li>
 * <li>otherwise {@code STABLE}</li>
 * </ul>
 * <p>
 * Confidence is {@code |slope| * sqrt(n)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    /** Minimum number of scores needed to fit a line. */
    static final int MIN_POINTS = 3;

    /** Absolute slope above which a trend is considered directional. */
    static final double SLOPE_THRESHOLD = 0.01;

    private final int windowSize;
    private final double emitEpsilon;
    private final Clock clock;

    private final ConcurrentMap<String, ScoreWindow> windows = new ConcurrentHashMap<>();

    /**
     * @param windowSize  number of scores kept per entity; at least {@value #MIN_POINTS}
     * @param emitEpsilon confidence level whose crossing triggers an event
     * @param clock       time source for results and events
     */
    public TrendAnalyzer(int windowSize, double emitEpsilon, Clock clock) {
        if (windowSize < MIN_POINTS) {
            throw new IllegalArgumentException("windowSize must be >= " + MIN_POINTS + ", got: " + windowSize);
        }
        if (!(emitEpsilon >= 0)) {
            throw new IllegalArgumentException("emitEpsilon must be >= 0, got: " + emitEpsilon);
        }
        this.windowSize = windowSize;
        this.emitEpsilon = emitEpsilon;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Append a score to the entity's window, evicting the oldest when full.
     */
    public void recordScore(String entityId, double score, Instant timestamp) {
        ScoreSnapshot snapshot = new ScoreSnapshot(entityId, timestamp, score);
        ScoreWindow window = windows.computeIfAbsent(entityId, id -> new ScoreWindow());
        synchronized (window) {
            window.points.addLast(snapshot);
            if (window.points.size() > windowSize) {
                window.points.pollFirst();
            }
        }
    }

    /**
     * Fit the current window. Does not change emit state.
     */
    public TrendResult analyze(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        ScoreWindow window = windows.get(entityId);
        if (window == null) {
            return TrendResult.insufficientData(entityId, 0, clock.instant());
        }
        double[] scores;
        synchronized (window) {
            scores = window.points.stream().mapToDouble(ScoreSnapshot::getScore).toArray();
        }
        return fit(entityId, scores, clock.instant());
    }

    /**
     * Analyze the window and decide whether subscribers should be told.
     *
     * <p>
     * An event is produced when the direction differs from the last emitted
     * direction (initially {@code STABLE}) or when the confidence crosses the
     * emit threshold in either direction.
     * </p>
     *
     * @return the event to publish, if any
     */
    public Optional<TrendEvent> evaluate(String entityId) {
        ScoreWindow window = windows.get(entityId);
        if (window == null) {
            return Optional.empty();
        }
        TrendResult result = analyze(entityId);
        synchronized (window) {
            window.latest = result;
            boolean confident = result.getConfidence() >= emitEpsilon;
            TrendDirection previous = window.lastEmitted;
            if (result.getDirection() == previous && confident == window.lastConfident) {
                return Optional.empty();
            }
            window.lastEmitted = result.getDirection();
            window.lastConfident = confident;
            LOG.info("Trend of '{}' is {} (was {}), slope={} confidence={}", entityId,
                    result.getDirection(), previous, result.getSlope(), result.getConfidence());
            return Optional.of(new TrendEvent(entityId, previous, result, result.getComputedAt()));
        }
    }

    /**
     * @return the result of the last {@link #evaluate(String)} call
     */
    public Optional<TrendResult> latest(String entityId) {
        ScoreWindow window = windows.get(entityId);
        if (window == null) {
            return Optional.empty();
        }
        synchronized (window) {
            return Optional.ofNullable(window.latest);
        }
    }

    /**
     * @return the entity's score window, oldest first
     */
    public List<ScoreSnapshot> history(String entityId) {
        ScoreWindow window = windows.get(entityId);
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            return List.copyOf(window.points);
        }
    }

    public void removeEntity(String entityId) {
        windows.remove(entityId);
    }

    // ---------------------------------------------------------------
    // Regression
    // ---------------------------------------------------------------

    static TrendResult fit(String entityId, double[] scores, Instant computedAt) {
        int n = scores.length;
        if (n < MIN_POINTS) {
            return TrendResult.insufficientData(entityId, n, computedAt);
        }
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumX2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += scores[i];
            sumXY += i * scores[i];
            sumX2 += (double) i * i;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
        TrendDirection direction = slope > SLOPE_THRESHOLD
                ? TrendDirection.IMPROVING
                : slope < -SLOPE_THRESHOLD ? TrendDirection.DECLINING : TrendDirection.STABLE;
        double confidence = Math.abs(slope) * Math.sqrt(n);
        return new TrendResult(entityId, slope, direction, confidence, n, computedAt);
    }

    private static final class ScoreWindow {
        final Deque<ScoreSnapshot> points = new ArrayDeque<>();
        TrendDirection lastEmitted = TrendDirection.STABLE;
        boolean lastConfident;
        TrendResult latest;
    }
}
