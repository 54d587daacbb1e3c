package com.ammann.connectorstats.enumeration;

/**
 * Binary byte units used to label byte-valued graph axes.
 *
 * <p>Each unit defines its size in bytes. A value is labelled with the largest unit that
 * does not exceed it, so axis labels stay in the range [1, 1024).
 */
public enum ByteUnit
{
    /** Plain bytes. */
    B(1L),
    /** 1024 bytes. */
    KB(1L << 10),
    /** 1024 KB. */
    MB(1L << 20),
    /** 1024 MB. */
    GB(1L << 30),
    /** 1024 GB. */
    TB(1L << 40);

    private final long bytes;

    ByteUnit(long bytes) {
        this.bytes = bytes;
    }

    /**
     * Returns the largest unit whose size does not exceed the given byte count.
     *
     * @param value byte count, typically the maximum value plotted on an axis
     * @return {@link #B} for values below one kilobyte, up to {@link #TB}
     */
    public static ByteUnit largestFor(double value) {
        if (value < KB.bytes) return B;
        if (value < MB.bytes) return KB;
        if (value < GB.bytes) return MB;
        if (value < TB.bytes) return GB;
        return TB;
    }

    /**
     * Converts a byte count into this unit.
     */
    public double convert(double value) {
        return value / bytes;
    }

    public long getBytes() { return bytes; }
}
