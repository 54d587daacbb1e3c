package com.ammann.connectorstats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Values plotted for one bucket of a sink statistics graph. {@code null} renders as a gap.
 */
@Schema(description = "Per-bucket rates of a sink connector")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SinkStatisticsRatesDTO(
        @Schema(description = "Messages staged per second", nullable = true)
        Double messagesStagedPerSecond,

        @Schema(description = "Messages committed per second", nullable = true)
        Double messagesCommittedPerSecond,

        @Schema(description = "Bytes staged per second", nullable = true)
        Double bytesStagedPerSecond,

        @Schema(description = "Bytes committed per second", nullable = true)
        Double bytesCommittedPerSecond
) {}
