package com.phillippitts.audiolink.domain;

import java.util.Objects;

/**
 * Tagged outcome of a decode: a recovered payload, no signal, or a classified failure.
 *
 * <p>Exactly one of the three shapes is ever built:
 * <ul>
 *   <li>{@link #decoded(Payload, TransmissionProfile)}: {@code payload} and {@code profile} set</li>
 *   <li>{@link #noSignal()}: kind {@link ErrorKind#NO_SIGNAL_DETECTED}</li>
 *   <li>{@link #failed(ErrorKind, String)}: any other kind with a caller-safe detail</li>
 * </ul>
 * A decoded empty message is {@code decoded(Payload.empty(), ...)} and never equals {@code noSignal()}.
 *
 * @param payload recovered message, or null unless decoded
 * @param profile profile the frame was found with, or null unless decoded
 * @param failure failure kind, or null when decoded
 * @param detail  human-readable detail for failures, or null when decoded
 */
public record DecodeResult(
        Payload payload,
        TransmissionProfile profile,
        ErrorKind failure,
        String detail
) {

    static final String NO_SIGNAL_DETAIL =
            "No message found: the audio was readable but contained no decodable transmission.";

    public DecodeResult {
        if (failure == null) {
            Objects.requireNonNull(payload, "Decoded result must carry a payload");
            Objects.requireNonNull(profile, "Decoded result must carry a profile");
            if (detail != null) {
                throw new IllegalArgumentException("Decoded result must not carry a failure detail");
            }
        } else {
            if (payload != null || profile != null) {
                throw new IllegalArgumentException("Failed result must not carry a payload");
            }
            Objects.requireNonNull(detail, "Failed result must carry a detail");
        }
    }

    public static DecodeResult decoded(Payload payload, TransmissionProfile profile) {
        return new DecodeResult(payload, profile, null, null);
    }

    public static DecodeResult noSignal() {
        return new DecodeResult(null, null, ErrorKind.NO_SIGNAL_DETECTED, NO_SIGNAL_DETAIL);
    }

    public static DecodeResult failed(ErrorKind kind, String detail) {
        Objects.requireNonNull(kind, "kind");
        if (kind == ErrorKind.NO_SIGNAL_DETECTED) {
            return noSignal();
        }
        return new DecodeResult(null, null, kind, detail);
    }

    public boolean isDecoded() {
        return failure == null;
    }

    public boolean isNoSignal() {
        return failure == ErrorKind.NO_SIGNAL_DETECTED;
    }

    /**
     * @return decoded text
     * @throws IllegalStateException if this result is not a successful decode
     */
    public String text() {
        if (!isDecoded()) {
            throw new IllegalStateException("No payload: decode ended with " + failure);
        }
        return payload.asText();
    }
}
