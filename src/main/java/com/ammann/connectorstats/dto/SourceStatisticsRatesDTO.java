package com.ammann.connectorstats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Values plotted for one bucket of a source statistics graph.
 *
 * <p>{@code null} means there was not enough data for the bucket and must be rendered as
 * a gap, not as zero.
 */
@Schema(description = "Per-bucket rates and offset lag of a source connector")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SourceStatisticsRatesDTO(
        @Schema(description = "Messages received per second", nullable = true)
        Double messagesReceivedPerSecond,

        @Schema(description = "Bytes received per second", nullable = true)
        Double bytesReceivedPerSecond,

        @Schema(description = "Updates staged per second", nullable = true)
        Double updatesStagedPerSecond,

        @Schema(description = "Updates committed per second", nullable = true)
        Double updatesCommittedPerSecond,

        @Schema(description = "Largest offset lag observed in the bucket", nullable = true)
        Double offsetDelta
) {}
