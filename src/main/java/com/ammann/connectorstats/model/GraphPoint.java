/* (C)2026 */
package com.ammann.connectorstats.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * One aggregated record per bucket: the bucket's end timestamp plus the reducer output.
 *
 * <p>The reducer values are serialized inline next to {@code timestamp}, so a source graph
 * point renders as {@code {"timestamp": ..., "bytesReceivedPerSecond": ..., ...}}.
 *
 * @param timestamp bucket end in epoch milliseconds
 * @param values    reducer output for the bucket
 * @param <R> reducer output type
 */
public record GraphPoint<R>(long timestamp, @JsonUnwrapped R values) {}
