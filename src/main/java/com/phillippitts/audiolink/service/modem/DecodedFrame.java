package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.domain.TransmissionProfile;

import java.util.Objects;

/**
 * A frame recovered by an {@link AcousticModem}: its payload and the profile it was sent with.
 */
public record DecodedFrame(byte[] payload, TransmissionProfile profile) {

    public DecodedFrame {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
    }
}
