package com.phillippitts.audiolink.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable message bytes carried by one acoustic transmission (UTF-8 text).
 *
 * <p>An empty payload is valid and produces the shortest possible frame.
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] bytes;

    private Payload(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Payload ofText(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new Payload(text.getBytes(StandardCharsets.UTF_8));
    }

    public static Payload ofBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return bytes.length == 0 ? EMPTY : new Payload(bytes.clone());
    }

    public static Payload empty() {
        return EMPTY;
    }

    /**
     * @return defensive copy of the raw bytes
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * Decodes the bytes as UTF-8. Malformed sequences are replaced, never rejected.
     */
    public String asText() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Payload other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Payload[length=" + bytes.length + "]";
    }
}
