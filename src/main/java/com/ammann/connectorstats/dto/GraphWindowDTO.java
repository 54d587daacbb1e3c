/* (C)2026 */
package com.ammann.connectorstats.dto;

import com.ammann.connectorstats.model.GraphWindow;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Time window of a rendered statistics graph.
 *
 * @param start        first visible instant (exclusive), epoch milliseconds
 * @param paddedStart  start of the data used for the first rates
 * @param end          last visible instant
 * @param bucketSizeMs width of one bucket
 * @param bucketCount  number of visible buckets
 */
@Schema(description = "Graph window and bucket grid")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphWindowDTO(
        @Schema(description = "Visible start in epoch milliseconds") Long start,
        @Schema(description = "Padded data start in epoch milliseconds") Long paddedStart,
        @Schema(description = "Visible end in epoch milliseconds") Long end,
        @Schema(description = "Bucket width in milliseconds") Long bucketSizeMs,
        @Schema(description = "Number of visible buckets") Integer bucketCount) {

    public static GraphWindowDTO from(GraphWindow window, int bucketCount) {
        return new GraphWindowDTO(
                window.startTimestamp(),
                window.paddedStartTimestamp(),
                window.endTimestamp(),
                window.bucketSizeMs(),
                bucketCount);
    }
}
