package com.phillippitts.audiolink.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable mono waveform: signed samples at a fixed rate and bit depth.
 *
 * <p>Samples are held as {@code short}; an 8-bit buffer stores values in {@code -128..127}.
 * {@link #toPcm16()} widens such a buffer to the 16-bit range the modem expects.
 */
public final class SampleBuffer {

    private final short[] samples;
    private final int sampleRate;
    private final int bitDepth;

    private SampleBuffer(short[] samples, int sampleRate, int bitDepth) {
        this.samples = samples;
        this.sampleRate = sampleRate;
        this.bitDepth = bitDepth;
    }

    /**
     * Creates a buffer from a copy of {@code samples}.
     *
     * @throws IllegalArgumentException if the sample rate is not positive or the bit depth is not 8 or 16
     */
    public static SampleBuffer of(short[] samples, int sampleRate, int bitDepth) {
        Objects.requireNonNull(samples, "samples must not be null");
        return wrap(samples.clone(), sampleRate, bitDepth);
    }

    /**
     * Creates a buffer that takes ownership of {@code samples} without copying.
     * Callers must not modify the array afterwards.
     */
    public static SampleBuffer wrap(short[] samples, int sampleRate, int bitDepth) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("Sample rate must be positive, got: " + sampleRate);
        }
        if (bitDepth != 8 && bitDepth != 16) {
            throw new IllegalArgumentException("Unsupported bit depth: " + bitDepth);
        }
        return new SampleBuffer(samples, sampleRate, bitDepth);
    }

    public short[] samples() {
        return samples.clone();
    }

    public int length() {
        return samples.length;
    }

    public short sampleAt(int index) {
        return samples[index];
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int bitDepth() {
        return bitDepth;
    }

    public long durationMillis() {
        return samples.length * 1000L / sampleRate;
    }

    /**
     * Copies {@code length} samples starting at {@code from} into a new buffer with the same format.
     */
    public SampleBuffer slice(int from, int length) {
        if (from < 0 || length < 0 || from + length > samples.length) {
            throw new IndexOutOfBoundsException("slice [" + from + ", " + (from + length)
                    + ") outside buffer of " + samples.length);
        }
        return new SampleBuffer(Arrays.copyOfRange(samples, from, from + length), sampleRate, bitDepth);
    }

    /**
     * Returns this buffer at 16-bit depth (identity for 16-bit buffers).
     */
    public SampleBuffer toPcm16() {
        if (bitDepth == 16) {
            return this;
        }
        short[] widened = new short[samples.length];
        for (int i = 0; i < samples.length; i++) {
            widened[i] = (short) (samples[i] << 8);
        }
        return new SampleBuffer(widened, sampleRate, 16);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SampleBuffer other
                && sampleRate == other.sampleRate
                && bitDepth == other.bitDepth
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(samples) + sampleRate) + bitDepth;
    }

    @Override
    public String toString() {
        return "SampleBuffer[samples=" + samples.length + ", sampleRate=" + sampleRate
                + ", bitDepth=" + bitDepth + "]";
    }
}
