/* (C)2026 */
package com.ammann.connectorstats.dto;

import com.ammann.connectorstats.model.SinkStatistics;
import com.ammann.connectorstats.model.StatisticsRow;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request to build a sink statistics graph from the rows received so far.
 */
@Schema(description = "Sink statistics rows and the graph time period")
public record SinkStatisticsGraphRequestDTO(
        @Schema(description = "Selected time period in minutes", example = "60")
        Integer timePeriodMinutes,

        @Schema(description = "Graph end in epoch milliseconds, defaults to now")
        Long endTimestamp,

        @Schema(description = "Time-ordered statistics rows including progress markers")
        List<StatisticsRow<SinkStatistics>> rows) {}
