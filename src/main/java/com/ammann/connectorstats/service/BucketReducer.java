/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.model.DataPoint;
import java.util.List;
import java.util.Optional;

/**
 * Reduces the points of one bucket to the values plotted for that bucket.
 *
 * <p>Implementations must cope with an empty {@code start} (no earlier data exists) and an
 * empty {@code points} list by reporting {@code null} values rather than failing.
 *
 * @param <T> statistics payload type
 * @param <R> reduced value type
 */
@FunctionalInterface
public interface BucketReducer<T, R> {

    /**
     * @param start  baseline point for rate calculations, if one could be found
     * @param points the bucket's points in time order
     * @return reduced values for the bucket
     */
    R reduce(Optional<DataPoint<T>> start, List<DataPoint<T>> points);
}
