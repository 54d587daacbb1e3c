/* (C)2026 */
package com.ammann.connectorstats.model;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Statistics of a data-source connector as reported by one statistics update.
 *
 * <p>Counters are cumulative and may reset. {@code offsetDelta} is a gauge (how far the
 * committed offset lags behind the known upstream offset). Every numeric field may be
 * {@code null} when the upstream system has not collected it yet.
 */
@Schema(description = "Cumulative statistics of a source connector")
public record SourceStatistics(
        @Schema(description = "Source identifier") String id,
        @Schema(description = "Replica the statistics were collected on") String replicaId,
        @Schema(description = "Replica name") String replicaName,
        @Schema(description = "Total bytes received") Long bytesReceived,
        @Schema(description = "Total messages received") Long messagesReceived,
        @Schema(description = "Total updates staged") Long updatesStaged,
        @Schema(description = "Total updates committed") Long updatesCommitted,
        @Schema(description = "Known upstream offset minus committed offset") Long offsetDelta,
        @Schema(description = "Snapshot records known") Long snapshotRecordsKnown,
        @Schema(description = "Snapshot records staged") Long snapshotRecordsStaged,
        @Schema(description = "Rehydration latency in milliseconds") Long rehydrationLatencyMs) {}
