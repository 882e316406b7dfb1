package com.phillippitts.audiolink.service.modem.fsk;

import java.util.Arrays;

/**
 * Growable window over an unbounded sample stream, addressed by absolute sample position.
 *
 * <p>Samples before {@link #start()} have been discarded; samples in {@code [start, end)} are
 * held in {@link #buffer()} from index 0. Not thread-safe.
 */
final class SampleAccumulator {

    private static final int INITIAL_CAPACITY = 1 << 16;

    private short[] buffer = new short[INITIAL_CAPACITY];
    private long start;
    private int size;

    void append(short[] samples, int offset, int length) {
        if (size + length > buffer.length) {
            int capacity = Math.max(buffer.length * 2, size + length);
            buffer = Arrays.copyOf(buffer, capacity);
        }
        System.arraycopy(samples, offset, buffer, size, length);
        size += length;
    }

    long start() {
        return start;
    }

    long end() {
        return start + size;
    }

    short[] buffer() {
        return buffer;
    }

    /**
     * Buffer index of an absolute position, which must lie in {@code [start, end]}.
     */
    int indexOf(long position) {
        if (position < start || position > end()) {
            throw new IllegalArgumentException("Position " + position + " outside [" + start + ", " + end() + "]");
        }
        return (int) (position - start);
    }

    /**
     * Drops every sample before {@code position}.
     */
    void discardBefore(long position) {
        if (position <= start) {
            return;
        }
        int drop = (int) Math.min(position - start, size);
        System.arraycopy(buffer, drop, buffer, 0, size - drop);
        size -= drop;
        start += drop;
    }

    void clear() {
        start = 0;
        size = 0;
        if (buffer.length > INITIAL_CAPACITY) {
            buffer = new short[INITIAL_CAPACITY];
        }
    }
}
