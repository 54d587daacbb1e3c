/* (C)2026 */
package com.ammann.connectorstats.model;

import java.util.List;

/**
 * Time window of a statistics graph and the bucket grid laid over it.
 *
 * <p>The padded start lies before the visible start so the first visible bucket has a
 * preceding point to compute a rate from. Buckets ending at or before {@code startTimestamp}
 * are only used as lookback context and are dropped from the rendered series.
 *
 * @param startTimestamp       first visible instant (exclusive), epoch milliseconds
 * @param paddedStartTimestamp start of the data window including padding
 * @param endTimestamp         last visible instant, epoch milliseconds
 * @param bucketSizeMs         width of each bucket
 * @param bucketEnds           ascending bucket end timestamps
 */
public record GraphWindow(
        long startTimestamp,
        long paddedStartTimestamp,
        long endTimestamp,
        long bucketSizeMs,
        List<Long> bucketEnds) {

    public GraphWindow {
        bucketEnds = List.copyOf(bucketEnds);
    }
}
