/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.exception.ValidationException;
import com.ammann.connectorstats.model.Bucket;
import com.ammann.connectorstats.model.DataPoint;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Groups normalized points into fixed-width buckets identified by caller-supplied end
 * timestamps.
 *
 * <p>Points are consumed with a single forward cursor. A bucket takes every remaining point
 * with {@code timestamp <= end}, but only keeps those at or after {@code end - bucketSizeMs}.
 * Dropped points should only appear before the first bucket, because callers pad the start
 * of the data window to have a baseline point for the first rate.
 *
 * <p>Every bucket end produces a bucket, empty or not, so the output stays positionally
 * aligned with the bucket ends.
 */
@ApplicationScoped
public class StatisticsBucketer {

    private static final Logger LOG = Logger.getLogger(StatisticsBucketer.class);

    /**
     * Buckets time-ordered points.
     *
     * @param points       time-ordered points, typically from {@link StatisticsNormalizer}
     * @param bucketEnds   non-decreasing bucket end timestamps
     * @param bucketSizeMs bucket width in milliseconds
     * @return one bucket per bucket end, in the same order
     * @throws ValidationException if the bucket size is negative
     */
    public <T> List<Bucket<T>> bucket(
            List<DataPoint<T>> points, List<Long> bucketEnds, long bucketSizeMs) {
        if (bucketSizeMs < 0) {
            throw ValidationException.invalidParameter("bucketSizeMs", bucketSizeMs, "non-negative integer");
        }
        if (bucketEnds == null || bucketEnds.isEmpty()) {
            return List.of();
        }
        List<DataPoint<T>> data = points == null ? List.of() : points;

        List<Bucket<T>> buckets = new ArrayList<>(bucketEnds.size());
        int dataIndex = 0;
        int dropped = 0;
        long previousEnd = Long.MIN_VALUE;

        for (long bucketEnd : bucketEnds) {
            if (bucketEnd < previousEnd) {
                // Best effort: the earlier points were already consumed, the bucket stays empty.
                LOG.debugf("Bucket end %d precedes previous end %d", bucketEnd, previousEnd);
            }
            previousEnd = bucketEnd;

            long bucketStart = bucketEnd - bucketSizeMs;
            List<DataPoint<T>> bucketPoints = new ArrayList<>();
            while (dataIndex < data.size() && data.get(dataIndex).timestamp() <= bucketEnd) {
                DataPoint<T> point = data.get(dataIndex);
                if (point.timestamp() >= bucketStart) {
                    bucketPoints.add(point);
                } else {
                    dropped++;
                }
                dataIndex++;
            }
            buckets.add(new Bucket<>(bucketEnd, bucketPoints));
        }

        LOG.debugf(
                "Bucketed %d points into %d buckets (%d outside their bucket, %d after the last)",
                data.size(), buckets.size(), dropped, data.size() - dataIndex);
        return buckets;
    }
}
