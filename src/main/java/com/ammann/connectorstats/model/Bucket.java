/* (C)2026 */
package com.ammann.connectorstats.model;

import java.util.List;
import java.util.Optional;

/**
 * Fixed-width time bucket identified by its (inclusive) end timestamp.
 *
 * <p>The start of the bucket is implicit: {@code endTimestamp - bucketSizeMs}, where the
 * bucket size is chosen by the caller that produced the bucket list.
 *
 * @param endTimestamp bucket end in epoch milliseconds
 * @param points       points falling into the bucket, in time order; may be empty
 * @param <T> payload type
 */
public record Bucket<T>(long endTimestamp, List<DataPoint<T>> points) {

    public Bucket {
        points = List.copyOf(points);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Optional<DataPoint<T>> first() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(0));
    }

    public Optional<DataPoint<T>> last() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
    }
}
