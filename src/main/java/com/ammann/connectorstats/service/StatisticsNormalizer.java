/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.exception.ValidationException;
import com.ammann.connectorstats.model.DataPoint;
import com.ammann.connectorstats.model.StatisticsRow;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Turns a raw upsert/progress statistics stream into a dense series with one point per
 * collection interval.
 *
 * <p>Statistics are only emitted when a value changes, so quiet periods show up as gaps
 * between updates. Three kinds of gap are filled with forward-filled (synthetic) points:
 * <ol>
 *   <li>The statistics never changed during the period: only the snapshot is present.
 *       Points are created every interval after the snapshot using its values. Their
 *       timestamps are synthetic since the real collection times are unknown.</li>
 *   <li>A gap at the beginning: the filler is aligned backwards from the first update after
 *       the snapshot, so synthetic and real points share one time grid.</li>
 *   <li>Gaps in the middle or at the end: points are created every interval after the most
 *       recent update until the next update or the latest known timestamp is reached.</li>
 * </ol>
 *
 * <p>The snapshot itself is never emitted, because its timestamp is based on arbitrary wall
 * clock time rather than on the collection schedule. Real updates are always emitted
 * unchanged.
 */
@ApplicationScoped
public class StatisticsNormalizer {

    private static final Logger LOG = Logger.getLogger(StatisticsNormalizer.class);

    static final double DEFAULT_VARIANCE_MARGIN = 0.1;

    /**
     * Fraction of the collection interval tolerated as timestamp jitter. Data does not always
     * arrive exactly on the interval.
     */
    @ConfigProperty(name = "connector.statistics.variance-margin", defaultValue = "0.1")
    double varianceMargin = DEFAULT_VARIANCE_MARGIN;

    /**
     * Normalizes a statistics stream using the configured variance margin.
     *
     * @param rows       time-ordered rows, progress markers included
     * @param intervalMs collection interval in milliseconds
     * @return normalized points in time order, empty while the stream is still loading
     */
    public <T> List<DataPoint<T>> normalize(List<StatisticsRow<T>> rows, long intervalMs) {
        return normalize(rows, intervalMs, varianceMargin);
    }

    /**
     * Normalizes a statistics stream using the configured variance margin, without
     * forward-filled points before {@code fromTimestamp}.
     */
    public <T> List<DataPoint<T>> normalizeFrom(
            List<StatisticsRow<T>> rows, long intervalMs, long fromTimestamp) {
        return normalize(rows, intervalMs, varianceMargin, fromTimestamp);
    }

    /**
     * Normalizes a statistics stream.
     *
     * @param rows           time-ordered rows, progress markers included
     * @param intervalMs     collection interval in milliseconds
     * @param varianceMargin tolerated jitter as a fraction of the interval
     * @return normalized points in time order, empty while the stream is still loading
     * @throws ValidationException if the interval is not positive or the margin is negative
     */
    public <T> List<DataPoint<T>> normalize(
            List<StatisticsRow<T>> rows, long intervalMs, double varianceMargin) {
        return normalize(rows, intervalMs, varianceMargin, Long.MIN_VALUE);
    }

    /**
     * Normalizes a statistics stream, leaving out forward-filled points stamped before
     * {@code fromTimestamp}. The remaining points are exactly those of the unbounded call, so
     * a stale snapshot does not cost one point per interval since it was taken.
     *
     * @param rows           time-ordered rows, progress markers included
     * @param intervalMs     collection interval in milliseconds
     * @param varianceMargin tolerated jitter as a fraction of the interval
     * @param fromTimestamp  earliest forward-filled point to create, epoch milliseconds
     * @return normalized points in time order, empty while the stream is still loading
     * @throws ValidationException if the interval is not positive or the margin is negative
     */
    public <T> List<DataPoint<T>> normalize(
            List<StatisticsRow<T>> rows, long intervalMs, double varianceMargin, long fromTimestamp) {
        if (intervalMs <= 0) {
            throw ValidationException.invalidParameter("intervalMs", intervalMs, "positive integer");
        }
        if (varianceMargin < 0 || Double.isNaN(varianceMargin)) {
            throw ValidationException.invalidParameter(
                    "varianceMargin", varianceMargin, "non-negative fraction");
        }
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }

        // Every row, progress or not, moves the horizon forward.
        long latestTimestamp = rows.get(rows.size() - 1).timestamp();
        List<StatisticsRow<T>> updates = rows.stream().filter(row -> !row.progress()).toList();
        if (updates.isEmpty()) {
            LOG.debugf("No snapshot among %d rows, statistics still loading", rows.size());
            return List.of();
        }

        GapFiller filler = new GapFiller(intervalMs, varianceMargin, fromTimestamp);
        StatisticsRow<T> snapshot = updates.get(0);
        List<DataPoint<T>> result = new ArrayList<>();

        if (updates.size() < 2) {
            // Nothing changed during the period, repeat the snapshot up to the horizon.
            result.addAll(filler.fillAfter(snapshot.timestamp(), latestTimestamp, snapshot.data()));
            return Collections.unmodifiableList(result);
        }

        StatisticsRow<T> firstAligned = updates.get(1);
        result.addAll(
                filler.fillBefore(snapshot.timestamp(), firstAligned.timestamp(), snapshot.data()));

        for (int index = 1; index < updates.size(); index++) {
            StatisticsRow<T> current = updates.get(index);
            if (current.timestamp() > latestTimestamp) {
                break;
            }
            long endingTimestamp =
                    index + 1 < updates.size() ? updates.get(index + 1).timestamp() : latestTimestamp;
            result.add(DataPoint.observed(current));
            if (filler.hasGap(current.timestamp(), endingTimestamp)) {
                result.addAll(filler.fillAfter(current.timestamp(), endingTimestamp, current.data()));
            }
        }

        LOG.debugf(
                "Normalized %d rows (%d updates) into %d points", rows.size(), updates.size(), result.size());
        return Collections.unmodifiableList(result);
    }

    /**
     * How many points to create between a pair of timestamps: the number of whole intervals
     * between them, less the one ending at {@code end}.
     *
     * <p>The gap can be shorter than one interval when updates arrive at the beginning of the
     * period, and arbitrarily long when there is a gap. The margin absorbs timestamps that
     * are a few milliseconds off the interval. Negative results mean no points.
     */
    static long pointsBetween(long start, long end, long intervalMs, double varianceMargin) {
        double gap = end - start + intervalMs * varianceMargin;
        return (long) Math.floor(gap / intervalMs) - 1;
    }

    /**
     * Creates forward-filled points for one collection interval and margin. Points before
     * {@code from} are skipped without being created.
     */
    private record GapFiller(long intervalMs, double varianceMargin, long from) {

        boolean hasGap(long start, long end) {
            return end - start > intervalMs * (1 + varianceMargin);
        }

        /** Points at {@code start + i * interval}, carrying {@code data}. */
        <T> List<DataPoint<T>> fillAfter(long start, long end, T data) {
            long count = pointsBetween(start, end, intervalMs, varianceMargin);
            long first = 1;
            if (start < from) {
                first = Math.max(first, Math.floorDiv(from - start + intervalMs - 1, intervalMs));
            }
            List<DataPoint<T>> points = new ArrayList<>();
            for (long i = first; i <= count; i++) {
                points.add(DataPoint.filled(start + i * intervalMs, data));
            }
            return points;
        }

        /** Points at {@code anchor - i * interval} in ascending order, carrying {@code data}. */
        <T> List<DataPoint<T>> fillBefore(long start, long anchor, T data) {
            long count = pointsBetween(start, anchor, intervalMs, varianceMargin);
            if (start < from) {
                count = Math.min(count, Math.floorDiv(anchor - from, intervalMs));
            }
            List<DataPoint<T>> points = new ArrayList<>();
            for (long i = count; i > 0; i--) {
                points.add(DataPoint.filled(anchor - i * intervalMs, data));
            }
            return points;
        }
    }
}
