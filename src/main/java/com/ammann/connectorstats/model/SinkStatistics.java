/* (C)2026 */
package com.ammann.connectorstats.model;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Cumulative statistics of a data-sink connector. Numeric fields may be {@code null}.
 */
@Schema(description = "Cumulative statistics of a sink connector")
public record SinkStatistics(
        @Schema(description = "Sink identifier") String id,
        @Schema(description = "Replica the statistics were collected on") String replicaId,
        @Schema(description = "Replica name") String replicaName,
        @Schema(description = "Total messages staged") Long messagesStaged,
        @Schema(description = "Total messages committed") Long messagesCommitted,
        @Schema(description = "Total bytes staged") Long bytesStaged,
        @Schema(description = "Total bytes committed") Long bytesCommitted) {}
