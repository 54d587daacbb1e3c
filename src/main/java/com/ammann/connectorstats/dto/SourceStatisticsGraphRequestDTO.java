/* (C)2026 */
package com.ammann.connectorstats.dto;

import com.ammann.connectorstats.model.SourceStatistics;
import com.ammann.connectorstats.model.StatisticsRow;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request to build a source statistics graph from the rows received so far.
 *
 * @param timePeriodMinutes selected time period in minutes
 * @param endTimestamp      graph end when the period was selected (epoch ms); defaults to now
 * @param rows              complete, time-ordered row snapshot of the subscription
 */
@Schema(description = "Source statistics rows and the graph time period")
public record SourceStatisticsGraphRequestDTO(
        @Schema(description = "Selected time period in minutes", example = "60")
        Integer timePeriodMinutes,

        @Schema(description = "Graph end in epoch milliseconds, defaults to now")
        Long endTimestamp,

        @Schema(description = "Time-ordered statistics rows including progress markers")
        List<StatisticsRow<SourceStatistics>> rows) {}
