/* (C)2026 */
package com.ammann.connectorstats.resource;

import com.ammann.connectorstats.dto.AxisTicksDTO;
import com.ammann.connectorstats.dto.SinkStatisticsGraphRequestDTO;
import com.ammann.connectorstats.dto.SinkStatisticsRatesDTO;
import com.ammann.connectorstats.dto.SourceStatisticsGraphRequestDTO;
import com.ammann.connectorstats.dto.SourceStatisticsRatesDTO;
import com.ammann.connectorstats.dto.StatisticsGraphResponseDTO;
import com.ammann.connectorstats.exception.ValidationException;
import com.ammann.connectorstats.model.AxisTicks;
import com.ammann.connectorstats.model.SinkStatistics;
import com.ammann.connectorstats.model.SourceStatistics;
import com.ammann.connectorstats.model.StatisticsRow;
import com.ammann.connectorstats.properties.ApiProperties;
import com.ammann.connectorstats.service.AxisTickCalculator;
import com.ammann.connectorstats.service.ConnectorStatisticsGraphService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for turning connector statistics streams into graph series.
 *
 * <p>Callers post the complete row snapshot of their statistics subscription together with
 * the selected time period, and receive one value record per bucket plus the y-axes of each
 * chart. The same request can be repeated as more rows arrive; nothing is kept between calls.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Statistics.BASE)
@Tag(name = "Statistics API", description = "Connector statistics graph series")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StatisticsResource {

    private static final Logger LOG = Logger.getLogger(StatisticsResource.class);
    private static final int MAX_TIME_PERIOD_MINUTES = 30 * 24 * 60;
    private static final int MAX_TICK_COUNT = 100;

    @Inject ConnectorStatisticsGraphService graphService;

    @Inject AxisTickCalculator axisTickCalculator;

    @ConfigProperty(name = "connector.statistics.max-clock-skew-ms", defaultValue = "300000")
    long maxClockSkewMs = 300_000L;

    Clock clock = Clock.systemUTC();

    @POST
    @Path(ApiProperties.Statistics.SOURCE_GRAPH)
    @Operation(
            summary = "Build Source Statistics Graph",
            description =
                    "Normalizes, buckets and aggregates source statistics rows into per-bucket"
                            + " ingestion rates and offset lag for the selected time period")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Graph built successfully",
                content =
                        @Content(schema = @Schema(implementation = StatisticsGraphResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid request"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response buildSourceGraph(SourceStatisticsGraphRequestDTO request) {
        if (request == null) {
            throw ValidationException.missing("request body");
        }
        int timePeriodMinutes = validateTimePeriod(request.timePeriodMinutes());
        long now = clock.millis();
        long end = validateEndTimestamp(request.endTimestamp(), now);
        List<StatisticsRow<SourceStatistics>> rows = validateRows(request.rows(), now);

        LOG.debugf("Source graph request: period=%d min, rows=%d", timePeriodMinutes, rows.size());

        StatisticsGraphResponseDTO<SourceStatisticsRatesDTO> response =
                graphService.buildSourceGraph(
                        timePeriodMinutes, end, rows);

        LOG.infof(
                "Source graph: %d rows into %d buckets", rows.size(), response.points().size());
        return Response.ok(response).build();
    }

    @POST
    @Path(ApiProperties.Statistics.SINK_GRAPH)
    @Operation(
            summary = "Build Sink Statistics Graph",
            description =
                    "Normalizes, buckets and aggregates sink statistics rows into per-bucket"
                            + " staged and committed rates for the selected time period")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Graph built successfully",
                content =
                        @Content(schema = @Schema(implementation = StatisticsGraphResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid request"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response buildSinkGraph(SinkStatisticsGraphRequestDTO request) {
        if (request == null) {
            throw ValidationException.missing("request body");
        }
        int timePeriodMinutes = validateTimePeriod(request.timePeriodMinutes());
        long now = clock.millis();
        long end = validateEndTimestamp(request.endTimestamp(), now);
        List<StatisticsRow<SinkStatistics>> rows = validateRows(request.rows(), now);

        LOG.debugf("Sink graph request: period=%d min, rows=%d", timePeriodMinutes, rows.size());

        StatisticsGraphResponseDTO<SinkStatisticsRatesDTO> response =
                graphService.buildSinkGraph(
                        timePeriodMinutes, end, rows);

        LOG.infof("Sink graph: %d rows into %d buckets", rows.size(), response.points().size());
        return Response.ok(response).build();
    }

    @GET
    @Path(ApiProperties.Statistics.AXIS_TICKS)
    @Operation(
            summary = "Calculate Axis Ticks",
            description = "Returns aligned bounds and evenly spaced ticks for a numeric domain")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Ticks calculated successfully",
                content = @Content(schema = @Schema(implementation = AxisTicksDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getAxisTicks(
            @Parameter(description = "Domain minimum") @QueryParam("min") @DefaultValue("0")
                    double min,
            @Parameter(description = "Domain maximum") @QueryParam("max") double max,
            @Parameter(description = "Desired number of ticks (max 100)")
                    @QueryParam("tickCount")
                    @DefaultValue("4")
                    int tickCount) {

        LOG.debugf("Axis ticks request: min=%f, max=%f, tickCount=%d", min, max, tickCount);

        if (tickCount > MAX_TICK_COUNT) {
            throw ValidationException.invalidParameter(
                    "tickCount", tickCount, "value less than or equal to " + MAX_TICK_COUNT);
        }

        AxisTicks ticks = axisTickCalculator.calculate(min, max, tickCount);
        return Response.ok(AxisTicksDTO.from(ticks)).build();
    }

    private int validateTimePeriod(Integer timePeriodMinutes) {
        if (timePeriodMinutes == null) {
            throw ValidationException.missing("timePeriodMinutes");
        }
        if (timePeriodMinutes <= 0 || timePeriodMinutes > MAX_TIME_PERIOD_MINUTES) {
            throw ValidationException.invalidParameter(
                    "timePeriodMinutes",
                    timePeriodMinutes,
                    "integer between 1 and " + MAX_TIME_PERIOD_MINUTES);
        }
        return timePeriodMinutes;
    }

    /**
     * Rejects rows the pipeline cannot interpret: update rows without data, rows that go back
     * in time and rows stamped outside [0, now + allowed clock skew].
     */
    private <T> List<StatisticsRow<T>> validateRows(List<StatisticsRow<T>> rows, long now) {
        if (rows == null) {
            return List.of();
        }
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < rows.size(); i++) {
            StatisticsRow<T> row = rows.get(i);
            if (row == null) {
                throw ValidationException.invalidParameter("rows[" + i + "]", null, "statistics row");
            }
            if (!row.progress() && row.data() == null) {
                throw ValidationException.invalidParameter(
                        "rows[" + i + "].data", null, "statistics on update rows");
            }
            if (row.timestamp() < 0 || row.timestamp() > latestAccepted(now)) {
                throw ValidationException.invalidParameter(
                        "rows[" + i + "].timestamp",
                        row.timestamp(),
                        "epoch milliseconds no later than the current time");
            }
            if (row.timestamp() < previous) {
                throw ValidationException.invalidParameter(
                        "rows[" + i + "].timestamp", row.timestamp(), "non-decreasing timestamps");
            }
            previous = row.timestamp();
        }
        return rows;
    }

    private long validateEndTimestamp(Long requested, long now) {
        if (requested == null) {
            return now;
        }
        if (requested <= 0 || requested > latestAccepted(now)) {
            throw ValidationException.invalidParameter(
                    "endTimestamp", requested, "epoch milliseconds no later than the current time");
        }
        return requested;
    }

    private long latestAccepted(long now) {
        long latest = now + maxClockSkewMs;
        return latest < now ? Long.MAX_VALUE : latest;
    }
}
