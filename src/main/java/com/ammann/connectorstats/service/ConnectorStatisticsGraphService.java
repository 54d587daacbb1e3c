/* (C)2026 */
package com.ammann.connectorstats.service;

import com.ammann.connectorstats.dto.AxisTicksDTO;
import com.ammann.connectorstats.dto.GraphWindowDTO;
import com.ammann.connectorstats.dto.SinkStatisticsRatesDTO;
import com.ammann.connectorstats.dto.SourceStatisticsRatesDTO;
import com.ammann.connectorstats.dto.StatisticsGraphResponseDTO;
import com.ammann.connectorstats.dto.YAxisDTO;
import com.ammann.connectorstats.enumeration.ByteUnit;
import com.ammann.connectorstats.enumeration.ConnectorType;
import com.ammann.connectorstats.model.AxisTicks;
import com.ammann.connectorstats.model.Bucket;
import com.ammann.connectorstats.model.DataPoint;
import com.ammann.connectorstats.model.GraphPoint;
import com.ammann.connectorstats.model.GraphWindow;
import com.ammann.connectorstats.model.SinkStatistics;
import com.ammann.connectorstats.model.SourceStatistics;
import com.ammann.connectorstats.model.StatisticsRow;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds connector statistics graphs from a complete row snapshot.
 *
 * <p>Pipeline per call: plan the window, normalize the stream, bucket the normalized points,
 * aggregate each bucket with the connector's reducer, drop the padding buckets and compute
 * one y-axis per chart. Every call recomputes from scratch; no state is kept between calls
 * apart from metrics.
 */
@ApplicationScoped
public class ConnectorStatisticsGraphService {

    private static final Logger LOG = Logger.getLogger(ConnectorStatisticsGraphService.class);

    static final int DEFAULT_Y_TICK_COUNT = 4;

    static final List<ChartAxis<SourceStatisticsRatesDTO>> SOURCE_CHARTS =
            List.of(
                    new ChartAxis<SourceStatisticsRatesDTO>(
                            "messages",
                            false,
                            Map.of(
                                    "messagesReceivedPerSecond",
                                    SourceStatisticsRatesDTO::messagesReceivedPerSecond)),
                    new ChartAxis<SourceStatisticsRatesDTO>(
                            "bytes",
                            true,
                            Map.of(
                                    "bytesReceivedPerSecond",
                                    SourceStatisticsRatesDTO::bytesReceivedPerSecond)),
                    new ChartAxis<SourceStatisticsRatesDTO>(
                            "updates",
                            false,
                            Map.of(
                                    "updatesStagedPerSecond",
                                    SourceStatisticsRatesDTO::updatesStagedPerSecond,
                                    "updatesCommittedPerSecond",
                                    SourceStatisticsRatesDTO::updatesCommittedPerSecond)),
                    new ChartAxis<SourceStatisticsRatesDTO>(
                            "offsetDelta",
                            false,
                            Map.of("offsetDelta", SourceStatisticsRatesDTO::offsetDelta)));

    static final List<ChartAxis<SinkStatisticsRatesDTO>> SINK_CHARTS =
            List.of(
                    new ChartAxis<SinkStatisticsRatesDTO>(
                            "messages",
                            false,
                            Map.of(
                                    "messagesStagedPerSecond",
                                    SinkStatisticsRatesDTO::messagesStagedPerSecond,
                                    "messagesCommittedPerSecond",
                                    SinkStatisticsRatesDTO::messagesCommittedPerSecond)),
                    new ChartAxis<SinkStatisticsRatesDTO>(
                            "bytes",
                            true,
                            Map.of(
                                    "bytesStagedPerSecond",
                                    SinkStatisticsRatesDTO::bytesStagedPerSecond,
                                    "bytesCommittedPerSecond",
                                    SinkStatisticsRatesDTO::bytesCommittedPerSecond)));

    GraphWindowPlanner windowPlanner;
    StatisticsNormalizer normalizer;
    StatisticsBucketer bucketer;
    BucketAggregator aggregator;
    AxisTickCalculator axisTickCalculator;
    SourceStatisticsReducer sourceReducer;
    SinkStatisticsReducer sinkReducer;
    MeterRegistry meterRegistry;

    @ConfigProperty(name = "connector.statistics.y-tick-count", defaultValue = "4")
    int yTickCount = DEFAULT_Y_TICK_COUNT;

    private volatile Map<ConnectorType, Counter> graphsBuiltCounters = Map.of();
    private volatile Counter rowsProcessedCounter;
    private volatile Counter syntheticPointsCounter;
    private volatile Timer graphBuildTimer;

    @Inject
    public ConnectorStatisticsGraphService(
            GraphWindowPlanner windowPlanner,
            StatisticsNormalizer normalizer,
            StatisticsBucketer bucketer,
            BucketAggregator aggregator,
            AxisTickCalculator axisTickCalculator,
            SourceStatisticsReducer sourceReducer,
            SinkStatisticsReducer sinkReducer,
            MeterRegistry meterRegistry) {
        this.windowPlanner = windowPlanner;
        this.normalizer = normalizer;
        this.bucketer = bucketer;
        this.aggregator = aggregator;
        this.axisTickCalculator = axisTickCalculator;
        this.sourceReducer = sourceReducer;
        this.sinkReducer = sinkReducer;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Registers graph metrics. Safe to call without a registry.
     */
    synchronized void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        Map<ConnectorType, Counter> counters = new EnumMap<>(ConnectorType.class);
        for (ConnectorType type : ConnectorType.values()) {
            counters.put(
                    type,
                    Counter.builder("connector_statistics_graphs_built_total")
                            .description("Statistics graphs built")
                            .tag("connector_type", type.name().toLowerCase())
                            .register(meterRegistry));
        }
        graphsBuiltCounters = Map.copyOf(counters);

        rowsProcessedCounter =
                Counter.builder("connector_statistics_rows_processed_total")
                        .description("Raw statistics rows processed")
                        .register(meterRegistry);

        syntheticPointsCounter =
                Counter.builder("connector_statistics_synthetic_points_total")
                        .description("Forward-filled points created by normalization")
                        .register(meterRegistry);

        graphBuildTimer =
                Timer.builder("connector_statistics_graph_duration_seconds")
                        .description("Statistics graph build duration")
                        .register(meterRegistry);
    }

    /**
     * Builds a source statistics graph.
     *
     * @param timePeriodMinutes selected time period in minutes
     * @param requestedEnd      graph end when the period was selected, epoch milliseconds
     * @param rows              complete row snapshot
     * @return graph points and axes
     */
    public StatisticsGraphResponseDTO<SourceStatisticsRatesDTO> buildSourceGraph(
            int timePeriodMinutes, long requestedEnd, List<StatisticsRow<SourceStatistics>> rows) {
        return buildGraph(
                ConnectorType.SOURCE, timePeriodMinutes, requestedEnd, rows, sourceReducer, SOURCE_CHARTS);
    }

    /**
     * Builds a sink statistics graph.
     *
     * @param timePeriodMinutes selected time period in minutes
     * @param requestedEnd      graph end when the period was selected, epoch milliseconds
     * @param rows              complete row snapshot
     * @return graph points and axes
     */
    public StatisticsGraphResponseDTO<SinkStatisticsRatesDTO> buildSinkGraph(
            int timePeriodMinutes, long requestedEnd, List<StatisticsRow<SinkStatistics>> rows) {
        return buildGraph(
                ConnectorType.SINK, timePeriodMinutes, requestedEnd, rows, sinkReducer, SINK_CHARTS);
    }

    <T, R> StatisticsGraphResponseDTO<R> buildGraph(
            ConnectorType type,
            int timePeriodMinutes,
            long requestedEnd,
            List<StatisticsRow<T>> rows,
            BucketReducer<T, R> reducer,
            List<ChartAxis<R>> charts) {
        if (meterRegistry != null && graphBuildTimer == null) {
            initMetrics();
        }
        long startNanos = System.nanoTime();

        List<StatisticsRow<T>> safeRows = rows == null ? List.of() : rows;
        GraphWindow window = windowPlanner.plan(timePeriodMinutes, requestedEnd, safeRows);

        List<GraphPoint<R>> visible = List.of();
        if (!safeRows.isEmpty()) {
            // Points before the padded start never reach a bucket.
            List<DataPoint<T>> normalized =
                    normalizer.normalizeFrom(
                            safeRows,
                            windowPlanner.getCollectionIntervalMs(),
                            window.paddedStartTimestamp());
            // No snapshot yet: the statistics are still loading.
            if (!normalized.isEmpty()) {
                List<Bucket<T>> buckets =
                        bucketer.bucket(normalized, window.bucketEnds(), window.bucketSizeMs());
                List<GraphPoint<R>> aggregated = aggregator.aggregate(buckets, reducer);

                // Buckets at or before the visible start only serve as lookback context.
                visible =
                        aggregated.stream()
                                .filter(point -> point.timestamp() > window.startTimestamp())
                                .toList();
            }

            recordMetrics(safeRows.size(), normalized);
        }

        List<YAxisDTO> axes = new ArrayList<>(charts.size());
        for (ChartAxis<R> chart : charts) {
            axes.add(yAxis(chart, visible));
        }

        Counter graphsBuilt = graphsBuiltCounters.get(type);
        if (graphsBuilt != null) {
            graphsBuilt.increment();
        }
        Timer buildTimer = graphBuildTimer;
        if (buildTimer != null) {
            buildTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }

        LOG.debugf(
                "Built %s graph: %d rows, %d visible buckets of %d ms",
                type, safeRows.size(), visible.size(), window.bucketSizeMs());
        return new StatisticsGraphResponseDTO<>(
                type, GraphWindowDTO.from(window, visible.size()), visible, axes);
    }

    /**
     * Computes the y-axis of one chart. The domain always includes zero and ignores nulls.
     */
    <R> YAxisDTO yAxis(ChartAxis<R> chart, List<GraphPoint<R>> points) {
        double min = 0;
        double max = 0;
        for (GraphPoint<R> point : points) {
            for (Function<R, Double> line : chart.lines().values()) {
                Double value = point.values() == null ? null : line.apply(point.values());
                if (value != null) {
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
            }
        }
        AxisTicks ticks = axisTickCalculator.calculate(min, max, yTickCount);
        ByteUnit unit = chart.bytes() ? ByteUnit.largestFor(max) : null;
        return new YAxisDTO(
                chart.name(),
                chart.lines().keySet().stream().sorted().toList(),
                AxisTicksDTO.from(ticks),
                unit);
    }

    private <T> void recordMetrics(int rowCount, List<DataPoint<T>> normalized) {
        if (rowsProcessedCounter != null) {
            rowsProcessedCounter.increment(rowCount);
        }
        if (syntheticPointsCounter != null) {
            syntheticPointsCounter.increment(normalized.stream().filter(DataPoint::synthetic).count());
        }
    }

    /**
     * A chart drawn from the graph points: its name, whether it plots bytes, and the plotted
     * fields by name.
     */
    record ChartAxis<R>(String name, boolean bytes, Map<String, Function<R, Double>> lines) {

        ChartAxis {
            Objects.requireNonNull(name, "name");
            lines = Map.copyOf(lines);
        }
    }
}
