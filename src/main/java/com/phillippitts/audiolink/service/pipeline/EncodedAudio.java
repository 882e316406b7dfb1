package com.phillippitts.audiolink.service.pipeline;

import com.phillippitts.audiolink.domain.TransmissionProfile;

import java.util.Objects;

/**
 * Result of the encode pipeline.
 *
 * @param wav         complete WAV file
 * @param contentType media type of {@code wav}
 * @param profile     profile the payload was modulated with
 * @param durationMs  playback length
 */
public record EncodedAudio(byte[] wav, String contentType, TransmissionProfile profile, long durationMs) {

    public EncodedAudio {
        Objects.requireNonNull(wav, "wav must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
    }
}
