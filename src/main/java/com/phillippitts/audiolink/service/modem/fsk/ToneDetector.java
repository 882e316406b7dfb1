package com.phillippitts.audiolink.service.modem.fsk;

import com.phillippitts.audiolink.domain.TransmissionProfile;

/**
 * Goertzel filter bank over the sixteen tones of one profile.
 *
 * <p>Every tone of every profile sits on an exact DFT bin of the profile's symbol window, so a
 * clean, aligned symbol scores a {@linkplain #ratio tone ratio} of 1.0 for its own tone and
 * close to 0.0 for the others.
 */
final class ToneDetector {

    private final int windowSize;
    private final double[] coefficients;

    ToneDetector(TransmissionProfile profile, int sampleRate) {
        this.windowSize = profile.samplesPerSymbol();
        this.coefficients = new double[TransmissionProfile.TONE_COUNT];
        for (int tone = 0; tone < coefficients.length; tone++) {
            double omega = 2.0 * Math.PI * profile.toneFrequencyHz(tone) / sampleRate;
            coefficients[tone] = 2.0 * Math.cos(omega);
        }
    }

    /**
     * Sum of squared samples over one window starting at {@code offset}.
     */
    double energy(short[] samples, int offset) {
        double sum = 0.0;
        for (int i = offset; i < offset + windowSize; i++) {
            double x = samples[i];
            sum += x * x;
        }
        return sum;
    }

    /**
     * Squared DFT magnitude of one tone over one window.
     */
    double power(short[] samples, int offset, int tone) {
        double coeff = coefficients[tone];
        double s1 = 0.0;
        double s2 = 0.0;
        for (int i = offset; i < offset + windowSize; i++) {
            double s0 = samples[i] + coeff * s1 - s2;
            s2 = s1;
            s1 = s0;
        }
        return s1 * s1 + s2 * s2 - coeff * s1 * s2;
    }

    /**
     * Fraction of the window's energy carried by one tone, in {@code [0, 1]}.
     */
    double ratio(short[] samples, int offset, int tone) {
        double energy = energy(samples, offset);
        return energy == 0.0 ? 0.0 : ratio(power(samples, offset, tone), energy);
    }

    /**
     * Strongest tone of a window.
     */
    Detection detect(short[] samples, int offset) {
        double energy = energy(samples, offset);
        int best = 0;
        double bestPower = -1.0;
        for (int tone = 0; tone < coefficients.length; tone++) {
            double p = power(samples, offset, tone);
            if (p > bestPower) {
                bestPower = p;
                best = tone;
            }
        }
        return new Detection(best, energy == 0.0 ? 0.0 : ratio(bestPower, energy));
    }

    private double ratio(double power, double energy) {
        // A pure on-bin sinusoid has power == (N/2) * energy
        return power / (windowSize / 2.0 * energy);
    }

    record Detection(int tone, double ratio) {
    }
}
