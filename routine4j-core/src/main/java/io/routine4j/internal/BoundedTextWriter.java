package io.routine4j.internal;

import java.io.Writer;

/**
 * Collects task output up to a fixed number of characters and silently drops the rest.
 */
final class BoundedTextWriter extends Writer {

    static final String TRUNCATION_MARKER = "... [output truncated]";

    private final int limit;
    private final StringBuilder buffer = new StringBuilder();
    private boolean truncated;

    BoundedTextWriter(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.limit = limit;
    }

    @Override
    public synchronized void write(char[] cbuf, int off, int len) {
        int room = limit - buffer.length();
        if (len > room) {
            truncated = true;
        }
        if (room > 0) {
            buffer.append(cbuf, off, Math.min(len, room));
        }
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }

    synchronized boolean isTruncated() {
        return truncated;
    }

    /**
     * Captured text, followed by {@link #TRUNCATION_MARKER} on its own line when output was dropped.
     */
    @Override
    public synchronized String toString() {
        if (!truncated) {
            return buffer.toString();
        }
        return buffer + System.lineSeparator() + TRUNCATION_MARKER;
    }
}
