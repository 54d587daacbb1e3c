/* (C)2026 */
package com.ammann.connectorstats.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One element of a connector statistics subscription stream.
 *
 * <p>Update rows carry the connector's statistics as of {@code timestamp}. Progress rows
 * carry no payload and only assert that nothing changed up to {@code timestamp}. The first
 * update row of a session is the snapshot; its timestamp is not aligned to the collection
 * interval.
 *
 * @param timestamp logical time of the row in epoch milliseconds
 * @param progress  whether this row is a progress marker
 * @param data      statistics payload, {@code null} for progress rows
 * @param <T> payload type
 */
@Schema(description = "Raw statistics row (update or progress marker)")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatisticsRow<T>(
        @Schema(description = "Logical timestamp in epoch milliseconds") long timestamp,
        @Schema(description = "True when the row only reports progress") boolean progress,
        @Schema(description = "Statistics payload, absent on progress rows") T data) {

    public static <T> StatisticsRow<T> update(long timestamp, T data) {
        return new StatisticsRow<>(timestamp, false, data);
    }

    public static <T> StatisticsRow<T> progress(long timestamp) {
        return new StatisticsRow<>(timestamp, true, null);
    }
}
