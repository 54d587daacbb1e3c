/* (C)2026 */
package com.ammann.connectorstats.model;

/**
 * A normalized statistics observation, aligned to the collection interval.
 *
 * @param timestamp epoch milliseconds
 * @param data      statistics payload as of {@code timestamp}
 * @param synthetic {@code true} when the point was forward-filled from an earlier value
 * @param <T> payload type
 */
public record DataPoint<T>(long timestamp, T data, boolean synthetic) {

    public static <T> DataPoint<T> observed(StatisticsRow<T> row) {
        return new DataPoint<>(row.timestamp(), row.data(), false);
    }

    public static <T> DataPoint<T> filled(long timestamp, T data) {
        return new DataPoint<>(timestamp, data, true);
    }
}
