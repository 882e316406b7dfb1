package com.phillippitts.audiolink.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Modulation settings of one transmission, trading duration against noise robustness.
 *
 * <p>All tone frequencies are whole multiples of the symbol's frequency resolution
 * ({@code sampleRate / samplesPerSymbol}), so every symbol holds an integer number of cycles.
 * Slower profiles use longer symbols and accept shorter payloads.
 *
 * <p>Values assume the 48 kHz sample rate fixed by
 * {@link com.phillippitts.audiolink.service.audio.AudioFormat}.
 */
public enum TransmissionProfile {

    AUDIBLE_NORMAL(Band.AUDIBLE, 1920, 1500.0, 100.0, 256),
    AUDIBLE_FAST(Band.AUDIBLE, 960, 1500.0, 100.0, 1024),
    AUDIBLE_FASTEST(Band.AUDIBLE, 480, 1500.0, 200.0, 4096),
    ULTRASOUND_NORMAL(Band.ULTRASOUND, 1920, 15_000.0, 100.0, 256),
    ULTRASOUND_FAST(Band.ULTRASOUND, 960, 15_000.0, 100.0, 1024),
    ULTRASOUND_FASTEST(Band.ULTRASOUND, 480, 15_000.0, 200.0, 4096);

    /** Number of distinct tones; one symbol carries one nibble. */
    public static final int TONE_COUNT = 16;

    /** Frequency range a profile's tones live in. */
    public enum Band { AUDIBLE, ULTRASOUND }

    private final Band band;
    private final int samplesPerSymbol;
    private final double baseFrequencyHz;
    private final double toneSpacingHz;
    private final int maxPayloadBytes;

    TransmissionProfile(Band band, int samplesPerSymbol, double baseFrequencyHz,
                        double toneSpacingHz, int maxPayloadBytes) {
        this.band = band;
        this.samplesPerSymbol = samplesPerSymbol;
        this.baseFrequencyHz = baseFrequencyHz;
        this.toneSpacingHz = toneSpacingHz;
        this.maxPayloadBytes = maxPayloadBytes;
    }

    public Band band() {
        return band;
    }

    public int samplesPerSymbol() {
        return samplesPerSymbol;
    }

    public double baseFrequencyHz() {
        return baseFrequencyHz;
    }

    public double toneSpacingHz() {
        return toneSpacingHz;
    }

    /** Largest payload this profile will frame, before any configured global cap. */
    public int maxPayloadBytes() {
        return maxPayloadBytes;
    }

    /**
     * Frequency of tone {@code index} (0..15).
     */
    public double toneFrequencyHz(int index) {
        if (index < 0 || index >= TONE_COUNT) {
            throw new IllegalArgumentException("Tone index out of range: " + index);
        }
        return baseFrequencyHz + index * toneSpacingHz;
    }

    /**
     * The next faster profile in the same band, if any.
     */
    public Optional<TransmissionProfile> fasterSibling() {
        TransmissionProfile[] all = values();
        for (int i = ordinal() + 1; i < all.length; i++) {
            if (all[i].band == band) {
                return Optional.of(all[i]);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a profile by name; accepts {@code AUDIBLE_FAST}, {@code audible_fast} and {@code audible-fast}.
     */
    public static Optional<TransmissionProfile> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.name().equals(normalized)).findFirst();
    }
}
