package com.ammann.connectorstats.service;

import com.ammann.connectorstats.exception.ValidationException;
import com.ammann.connectorstats.model.DataPoint;
import com.ammann.connectorstats.model.SourceStatistics;
import com.ammann.connectorstats.model.StatisticsRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.ammann.connectorstats.support.TestDataFactory.DATA_INTERVAL;
import static com.ammann.connectorstats.support.TestDataFactory.SNAPSHOT_TIME;
import static com.ammann.connectorstats.support.TestDataFactory.bytesReceived;
import static com.ammann.connectorstats.support.TestDataFactory.minutesAfterSnapshot;
import static com.ammann.connectorstats.support.TestDataFactory.progress;
import static com.ammann.connectorstats.support.TestDataFactory.secondsAfterSnapshot;
import static com.ammann.connectorstats.support.TestDataFactory.sourceStatistics;
import static com.ammann.connectorstats.support.TestDataFactory.sourceUpdate;
import static com.ammann.connectorstats.support.TestDataFactory.update;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StatisticsNormalizer}.
 *
 * <p>Covers the three gap-filling cases (snapshot only, gap after the snapshot, gaps in the
 * middle and at the end), timestamp jitter within the variance margin, and the loading
 * states that produce no points.
 */
class StatisticsNormalizerTest
{

    private final StatisticsNormalizer normalizer = new StatisticsNormalizer();

    @Test
    void returnsNothingForEmptyData()
    {
        assertThat(normalizer.normalize(List.<StatisticsRow<SourceStatistics>>of(), DATA_INTERVAL)).isEmpty();
        assertThat(normalizer.normalize(null, DATA_INTERVAL)).isEmpty();
    }

    @Test
    void returnsNothingWhileOnlyProgressHasArrived()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                progress(SNAPSHOT_TIME),
                progress(minutesAfterSnapshot(5)));

        assertThat(normalizer.normalize(rows, DATA_INTERVAL)).isEmpty();
    }

    @Test
    @DisplayName("fills k-1 points for progress k intervals after the snapshot, the horizon slot itself is not emitted")
    void insertsPointsAfterSnapshotWhenNothingChanged()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                progress(minutesAfterSnapshot(3)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T12:01:00Z"),
                Instant.parse("2024-01-01T12:02:00Z"));
        assertThat(result).allMatch(DataPoint::synthetic);
    }

    @Test
    void quietPeriodPointsAreEvenlySpacedCopiesOfTheSnapshot()
    {
        SourceStatistics snapshot = sourceStatistics(2, 3, 7, 6, 1);
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(SNAPSHOT_TIME, snapshot),
                progress(minutesAfterSnapshot(10)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(result).hasSize(9);
        assertThat(result).extracting(DataPoint::data).containsOnly(snapshot);
        for (int i = 1; i < result.size(); i++) {
            assertThat(result.get(i).timestamp() - result.get(i - 1).timestamp()).isEqualTo(DATA_INTERVAL);
        }
    }

    @Test
    void synthesizedPointsCarryTheSnapshotValues()
    {
        SourceStatistics snapshot = new SourceStatistics("1", "u1", "r1", 2L, 3L, 7L, 6L, 1L, 8L, 9L, 93_676L);
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(SNAPSHOT_TIME, snapshot),
                progress(minutesAfterSnapshot(2)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(result).extracting(DataPoint::data).containsExactly(snapshot);
    }

    @Test
    void insertsPointsAfterSnapshotWhenThereIsAGap()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(minutesAfterSnapshot(2)),
                progress(minutesAfterSnapshot(2)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T12:01:00Z"),
                Instant.parse("2024-01-01T12:02:00Z"));
        assertThat(result.get(0).synthetic()).isTrue();
        assertThat(result.get(1).synthetic()).isFalse();
    }

    @Test
    void alignsInitialPointsWhenTimestampsAreSlightlyOff()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(secondsAfterSnapshot(119)),
                progress(minutesAfterSnapshot(2)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T12:00:59Z"),
                Instant.parse("2024-01-01T12:01:59Z"));
    }

    @Test
    void insertsPointsInTheMiddle()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(secondsAfterSnapshot(60)),
                sourceUpdate(secondsAfterSnapshot(180)),
                progress(minutesAfterSnapshot(3)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T12:01:00Z"),
                Instant.parse("2024-01-01T12:02:00Z"),
                Instant.parse("2024-01-01T12:03:00Z"));
    }

    @Test
    void insertsPointsInTheMiddleWhenTimestampsAreSlightlyOff()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(secondsAfterSnapshot(60)),
                sourceUpdate(secondsAfterSnapshot(179)),
                sourceUpdate(secondsAfterSnapshot(301)),
                progress(minutesAfterSnapshot(6)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T12:01:00Z"),
                Instant.parse("2024-01-01T12:02:00Z"),
                Instant.parse("2024-01-01T12:02:59Z"),
                Instant.parse("2024-01-01T12:03:59Z"),
                Instant.parse("2024-01-01T12:05:01Z"));
    }

    @Test
    void insertsPointsAtTheEnd()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(secondsAfterSnapshot(60)),
                progress(minutesAfterSnapshot(3)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T12:01:00Z"),
                Instant.parse("2024-01-01T12:02:00Z"));
    }

    @Test
    void forwardFillCarriesThePrecedingUpdate()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(SNAPSHOT_TIME, bytesReceived(0)),
                update(secondsAfterSnapshot(60), bytesReceived(5)),
                update(secondsAfterSnapshot(240), bytesReceived(9)),
                progress(minutesAfterSnapshot(4)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(result).extracting(point -> point.data().bytesReceived())
                .containsExactly(5L, 5L, 5L, 9L);
        assertThat(result).extracting(DataPoint::synthetic)
                .containsExactly(false, true, true, false);
    }

    @Test
    void preservesEveryUpdateAfterTheSnapshotVerbatim()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(SNAPSHOT_TIME, bytesReceived(0)),
                update(secondsAfterSnapshot(61), bytesReceived(1)),
                update(secondsAfterSnapshot(121), bytesReceived(2)),
                progress(secondsAfterSnapshot(150)),
                update(secondsAfterSnapshot(420), bytesReceived(3)),
                progress(minutesAfterSnapshot(9)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        List<DataPoint<SourceStatistics>> observed = result.stream().filter(point -> !point.synthetic()).toList();
        assertThat(observed).extracting(DataPoint::timestamp).containsExactly(
                secondsAfterSnapshot(61), secondsAfterSnapshot(121), secondsAfterSnapshot(420));
        assertThat(observed).extracting(point -> point.data().bytesReceived()).containsExactly(1L, 2L, 3L);
        assertThat(result).extracting(DataPoint::timestamp).isSorted().doesNotHaveDuplicates();
    }

    @Test
    void usesTheLastUpdateAsHorizonWithoutProgressMarkers()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(SNAPSHOT_TIME, bytesReceived(0)),
                update(secondsAfterSnapshot(119), bytesReceived(10)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(result).extracting(DataPoint::timestamp)
                .containsExactly(secondsAfterSnapshot(59), secondsAfterSnapshot(119));
        assertThat(result).extracting(point -> point.data().bytesReceived()).containsExactly(0L, 10L);
    }

    @Test
    void doesNotFillGapsWithinTheVarianceMargin()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(secondsAfterSnapshot(60)),
                sourceUpdate(secondsAfterSnapshot(125)),
                progress(secondsAfterSnapshot(125)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(result).noneMatch(DataPoint::synthetic);
        assertThat(result).hasSize(2);
    }

    @Test
    void widerMarginFillsLateUpdates()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(secondsAfterSnapshot(60)),
                sourceUpdate(secondsAfterSnapshot(165)),
                progress(secondsAfterSnapshot(165)));

        assertThat(normalizer.normalize(rows, DATA_INTERVAL, 0.1)).noneMatch(DataPoint::synthetic);
        assertThat(normalizer.normalize(rows, DATA_INTERVAL, 0.3))
                .filteredOn(DataPoint::synthetic)
                .extracting(DataPoint::timestamp)
                .containsExactly(secondsAfterSnapshot(120));
    }

    @Test
    void toleratesDuplicateTimestamps()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(SNAPSHOT_TIME),
                sourceUpdate(secondsAfterSnapshot(60)),
                sourceUpdate(secondsAfterSnapshot(60)),
                progress(secondsAfterSnapshot(60)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(rows, DATA_INTERVAL);

        assertThat(result).extracting(DataPoint::timestamp)
                .containsExactly(secondsAfterSnapshot(60), secondsAfterSnapshot(60));
    }

    @Test
    void isReferentiallyTransparent()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(SNAPSHOT_TIME, bytesReceived(0)),
                update(secondsAfterSnapshot(179), bytesReceived(4)),
                progress(minutesAfterSnapshot(7)));

        assertThat(normalizer.normalize(rows, DATA_INTERVAL))
                .isEqualTo(normalizer.normalize(rows, DATA_INTERVAL));
    }

    @Test
    void lowerBoundSkipsFilledPointsOfAStaleSnapshot()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                sourceUpdate(0L),
                progress(SNAPSHOT_TIME));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(
                rows, DATA_INTERVAL, 0.1, SNAPSHOT_TIME - 5 * DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T11:55:00Z"),
                Instant.parse("2024-01-01T11:56:00Z"),
                Instant.parse("2024-01-01T11:57:00Z"),
                Instant.parse("2024-01-01T11:58:00Z"),
                Instant.parse("2024-01-01T11:59:00Z"));
    }

    @Test
    void lowerBoundKeepsBackwardAlignmentAfterStaleSnapshot()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(0L, bytesReceived(0)),
                update(secondsAfterSnapshot(30), bytesReceived(60)),
                progress(secondsAfterSnapshot(150)));

        List<DataPoint<SourceStatistics>> result = normalizer.normalize(
                rows, DATA_INTERVAL, 0.1, SNAPSHOT_TIME - 2 * DATA_INTERVAL);

        assertThat(timestamps(result)).containsExactly(
                Instant.parse("2024-01-01T11:58:30Z"),
                Instant.parse("2024-01-01T11:59:30Z"),
                Instant.parse("2024-01-01T12:00:30Z"),
                Instant.parse("2024-01-01T12:01:30Z"));
        assertThat(result.get(2).synthetic()).isFalse();
    }

    @Test
    void lowerBoundOnlyRemovesEarlierPoints()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(
                update(SNAPSHOT_TIME, bytesReceived(0)),
                update(minutesAfterSnapshot(10), bytesReceived(5)),
                update(minutesAfterSnapshot(14), bytesReceived(9)),
                progress(minutesAfterSnapshot(20)));
        long from = minutesAfterSnapshot(12);

        List<DataPoint<SourceStatistics>> unbounded = normalizer.normalize(rows, DATA_INTERVAL, 0.1);
        List<DataPoint<SourceStatistics>> bounded = normalizer.normalize(rows, DATA_INTERVAL, 0.1, from);

        assertThat(bounded).isEqualTo(unbounded.stream()
                .filter(point -> !point.synthetic() || point.timestamp() >= from)
                .toList());
    }

    @Test
    void pointsBetweenCountsWholeIntervalsExcludingTheEnd()
    {
        assertThat(StatisticsNormalizer.pointsBetween(0, 180_000, DATA_INTERVAL, 0.1)).isEqualTo(2);
        assertThat(StatisticsNormalizer.pointsBetween(0, 119_000, DATA_INTERVAL, 0.1)).isEqualTo(1);
        assertThat(StatisticsNormalizer.pointsBetween(0, 30_000, DATA_INTERVAL, 0.1)).isEqualTo(-1);
    }

    @Test
    void rejectsInvalidParameters()
    {
        List<StatisticsRow<SourceStatistics>> rows = List.of(sourceUpdate(SNAPSHOT_TIME));

        assertThatThrownBy(() -> normalizer.normalize(rows, 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> normalizer.normalize(rows, DATA_INTERVAL, -0.1))
                .isInstanceOf(ValidationException.class);
    }

    private static List<Instant> timestamps(List<DataPoint<SourceStatistics>> points)
    {
        return points.stream().map(point -> Instant.ofEpochMilli(point.timestamp())).toList();
    }
}
