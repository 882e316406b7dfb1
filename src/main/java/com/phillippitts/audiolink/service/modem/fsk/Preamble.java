package com.phillippitts.audiolink.service.modem.fsk;

import com.phillippitts.audiolink.domain.TransmissionProfile;

/**
 * Eight-tone start marker. Each profile rotates the base pattern so that preambles of
 * different profiles in the same band never share a first tone.
 */
final class Preamble {

    static final int LENGTH = 8;

    private static final int[] BASE = {1, 14, 4, 11, 7, 8, 2, 13};

    private Preamble() {
    }

    static int[] tonesFor(TransmissionProfile profile) {
        int[] tones = new int[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            tones[i] = (BASE[i] + 3 * profile.ordinal()) % TransmissionProfile.TONE_COUNT;
        }
        return tones;
    }
}
