/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.exception.ValidationException;
import com.ammann.connectorstats.model.Bucket;
import com.ammann.connectorstats.model.DataPoint;
import com.ammann.connectorstats.model.GraphPoint;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Applies a {@link BucketReducer} to each bucket, supplying a baseline point for rates.
 *
 * <p>A bucket with at least two points uses its own first point as the baseline. Otherwise
 * the last point of the closest non-empty preceding bucket is used. This always happens on
 * short periods, where buckets are barely wider than the collection interval and often hold
 * a single point.
 */
@ApplicationScoped
public class BucketAggregator {

    private static final Logger LOG = Logger.getLogger(BucketAggregator.class);

    /**
     * Aggregates buckets into one graph point each.
     *
     * @param buckets buckets in time order
     * @param reducer reducer producing the per-bucket values
     * @return one graph point per bucket, in the same order, timestamped with the bucket end
     */
    public <T, R> List<GraphPoint<R>> aggregate(List<Bucket<T>> buckets, BucketReducer<T, R> reducer) {
        if (reducer == null) {
            throw ValidationException.invalidParameter("reducer", null, "bucket reducer");
        }
        if (buckets == null || buckets.isEmpty()) {
            return List.of();
        }

        List<GraphPoint<R>> result = new ArrayList<>(buckets.size());
        int withoutBaseline = 0;
        for (int i = 0; i < buckets.size(); i++) {
            Bucket<T> bucket = buckets.get(i);
            Optional<DataPoint<T>> start = baseline(buckets, i);
            if (start.isEmpty()) {
                withoutBaseline++;
            }
            result.add(new GraphPoint<>(bucket.endTimestamp(), reducer.reduce(start, bucket.points())));
        }

        LOG.debugf("Aggregated %d buckets, %d without a baseline point", buckets.size(), withoutBaseline);
        return result;
    }

    /**
     * Finds the baseline point for bucket {@code index}, looking back down to bucket 0.
     */
    static <T> Optional<DataPoint<T>> baseline(List<Bucket<T>> buckets, int index) {
        Bucket<T> bucket = buckets.get(index);
        if (bucket.points().size() > 1) {
            return bucket.first();
        }
        for (int lookback = index - 1; lookback >= 0; lookback--) {
            Optional<DataPoint<T>> last = buckets.get(lookback).last();
            if (last.isPresent()) {
                return last;
            }
        }
        return Optional.empty();
    }
}
