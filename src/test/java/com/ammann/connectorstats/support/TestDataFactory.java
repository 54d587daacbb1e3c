/* (C)2026 */
package com.ammann.connectorstats.support;

import com.ammann.connectorstats.model.DataPoint;
import com.ammann.connectorstats.model.SinkStatistics;
import com.ammann.connectorstats.model.SourceStatistics;
import com.ammann.connectorstats.model.StatisticsRow;
import java.time.Duration;
import java.time.Instant;

/**
 * Factory methods for statistics rows and points used across tests.
 */
public final class TestDataFactory {

    public static final long SNAPSHOT_TIME = Instant.parse("2024-01-01T12:00:00Z").toEpochMilli();
    public static final long DATA_INTERVAL = 60_000L;

    private TestDataFactory() {}

    public static long minutesAfterSnapshot(double minutes) {
        return SNAPSHOT_TIME + Math.round(minutes * 60_000);
    }

    public static long secondsAfterSnapshot(long seconds) {
        return SNAPSHOT_TIME + Duration.ofSeconds(seconds).toMillis();
    }

    /**
     * Source statistics with every counter at zero and no rehydration latency.
     */
    public static SourceStatistics zeroSourceStatistics() {
        return new SourceStatistics("u1", "r1", "replica", 0L, 0L, 0L, 0L, 0L, 0L, 0L, null);
    }

    public static SourceStatistics sourceStatistics(
            long bytesReceived,
            long messagesReceived,
            long updatesStaged,
            long updatesCommitted,
            long offsetDelta) {
        return new SourceStatistics(
                "u1",
                "r1",
                "replica",
                bytesReceived,
                messagesReceived,
                updatesStaged,
                updatesCommitted,
                offsetDelta,
                0L,
                0L,
                null);
    }

    public static SourceStatistics bytesReceived(long bytes) {
        return sourceStatistics(bytes, 0, 0, 0, 0);
    }

    public static SinkStatistics sinkStatistics(
            long messagesStaged, long messagesCommitted, long bytesStaged, long bytesCommitted) {
        return new SinkStatistics(
                "u2", "r1", "replica", messagesStaged, messagesCommitted, bytesStaged, bytesCommitted);
    }

    public static StatisticsRow<SourceStatistics> sourceUpdate(long timestamp) {
        return StatisticsRow.update(timestamp, zeroSourceStatistics());
    }

    public static <T> StatisticsRow<T> update(long timestamp, T data) {
        return StatisticsRow.update(timestamp, data);
    }

    public static <T> StatisticsRow<T> progress(long timestamp) {
        return StatisticsRow.progress(timestamp);
    }

    public static DataPoint<SourceStatistics> sourcePoint(long timestamp) {
        return DataPoint.observed(sourceUpdate(timestamp));
    }

    public static DataPoint<SourceStatistics> sourcePoint(long timestamp, SourceStatistics data) {
        return DataPoint.observed(StatisticsRow.update(timestamp, data));
    }
}
