/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.exception.ValidationException;
import com.ammann.connectorstats.model.GraphWindow;
import com.ammann.connectorstats.model.StatisticsRow;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Derives the visible window, the padded data window and the bucket grid of a statistics
 * graph from the selected time period.
 *
 * <p>The end of the graph follows the stream: once data newer than the requested end
 * arrives, the window slides forward. The data window starts a few collection intervals
 * before the visible start so the first visible bucket can compute a rate.
 */
@ApplicationScoped
public class GraphWindowPlanner {

    private static final Logger LOG = Logger.getLogger(GraphWindowPlanner.class);

    static final long DEFAULT_COLLECTION_INTERVAL_MS = 60_000L;
    static final int DEFAULT_PADDING_INTERVALS = 2;

    @ConfigProperty(name = "connector.statistics.collection-interval-ms", defaultValue = "60000")
    long collectionIntervalMs = DEFAULT_COLLECTION_INTERVAL_MS;

    @ConfigProperty(name = "connector.statistics.padding-intervals", defaultValue = "2")
    int paddingIntervals = DEFAULT_PADDING_INTERVALS;

    /**
     * Plans the graph window.
     *
     * @param timePeriodMinutes selected time period in minutes
     * @param requestedEnd      end of the graph when it was first requested, epoch milliseconds
     * @param rows              rows received so far, used to slide the end forward
     * @return the window and its bucket ends
     * @throws ValidationException if the time period is not positive
     */
    public GraphWindow plan(int timePeriodMinutes, long requestedEnd, List<? extends StatisticsRow<?>> rows) {
        if (timePeriodMinutes <= 0) {
            throw ValidationException.invalidParameter(
                    "timePeriodMinutes", timePeriodMinutes, "positive integer");
        }

        long end = requestedEnd;
        if (rows != null && rows.size() > 1) {
            long newest = rows.get(rows.size() - 1).timestamp();
            if (newest > end) {
                end = newest;
            }
        }

        long periodMs = Duration.ofMinutes(timePeriodMinutes).toMillis();
        long paddedSpanMs = periodMs + paddingIntervals * collectionIntervalMs;
        long start;
        long paddedStart;
        try {
            start = Math.subtractExact(end, periodMs);
            paddedStart = Math.subtractExact(end, paddedSpanMs);
        } catch (ArithmeticException e) {
            throw ValidationException.invalidParameter("endTimestamp", end, "epoch milliseconds");
        }

        // Never use a bucket smaller than the collection interval.
        long bucketSizeMs = Math.max(timePeriodMinutes * 1000L, collectionIntervalMs);

        // Counting from the span keeps every bucket end within [paddedStart, end].
        long bucketCount = paddedSpanMs / bucketSizeMs;
        List<Long> bucketEnds = new ArrayList<>((int) bucketCount);
        for (long k = 1; k <= bucketCount; k++) {
            bucketEnds.add(paddedStart + k * bucketSizeMs);
        }

        LOG.debugf(
                "Planned %d minute window ending %d: %d buckets of %d ms",
                timePeriodMinutes, end, bucketEnds.size(), bucketSizeMs);
        return new GraphWindow(start, paddedStart, end, bucketSizeMs, bucketEnds);
    }

    public long getCollectionIntervalMs() {
        return collectionIntervalMs;
    }
}
