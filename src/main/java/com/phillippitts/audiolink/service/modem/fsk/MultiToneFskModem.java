package com.phillippitts.audiolink.service.modem.fsk;

import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.service.audio.AudioFormat;
import com.phillippitts.audiolink.service.modem.AcousticModem;
import com.phillippitts.audiolink.service.modem.DecodedFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sixteen-tone FSK modem: each payload byte is sent as two 4-bit symbols, one tone per symbol.
 *
 * <p><b>Transmission layout:</b>
 * <pre>
 * | silence 100ms | preamble (8 symbols) | length (4) | payload (2 per byte) | CRC-32 (8) | silence 100ms |
 * </pre>
 *
 * <p>Tones are whole-cycle sinusoids on exact DFT bins of the symbol window, so symbol
 * boundaries are phase-continuous and a Goertzel filter recovers each symbol cleanly.
 *
 * <p><b>Receive side:</b> one {@link PreambleScanner} per profile searches the same
 * {@link SampleAccumulator}; the first complete frame wins. The accumulator is compacted to
 * the oldest position any scanner still needs, so memory stays bounded by the longest
 * pending frame.
 *
 * <p><b>Thread Safety:</b> not thread-safe; one borrower at a time (see
 * {@link com.phillippitts.audiolink.service.modem.ModemPool}).
 */
public final class MultiToneFskModem implements AcousticModem {

    private static final Logger LOG = LogManager.getLogger(MultiToneFskModem.class);

    static final String MODEM_NAME = "mtfsk";
    static final int SILENCE_SAMPLES = AudioFormat.MODEM_SAMPLE_RATE / 10;

    private final double amplitude;
    private final SampleAccumulator accumulator = new SampleAccumulator();
    private final List<PreambleScanner> scanners = new ArrayList<>();
    private volatile boolean closed;

    /**
     * @param volume output level in percent of full scale (1-100)
     */
    public MultiToneFskModem(int volume) {
        if (volume < 1 || volume > 100) {
            throw new IllegalArgumentException("Volume must be within 1..100, got: " + volume);
        }
        this.amplitude = volume / 100.0 * Short.MAX_VALUE;
        for (TransmissionProfile profile : TransmissionProfile.values()) {
            scanners.add(new PreambleScanner(profile, AudioFormat.MODEM_SAMPLE_RATE));
        }
    }

    @Override
    public short[] modulate(byte[] payload, TransmissionProfile profile) {
        ensureOpen();
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        if (payload.length > profile.maxPayloadBytes()) {
            throw new IllegalArgumentException("Payload of " + payload.length + " bytes exceeds "
                    + profile + " ceiling of " + profile.maxPayloadBytes());
        }

        int[] preamble = Preamble.tonesFor(profile);
        int[] frame = FrameCodec.toSymbols(payload);
        int n = profile.samplesPerSymbol();
        short[] out = new short[2 * SILENCE_SAMPLES + (preamble.length + frame.length) * n];

        int offset = SILENCE_SAMPLES;
        for (int tone : preamble) {
            writeTone(out, offset, n, profile.toneFrequencyHz(tone));
            offset += n;
        }
        for (int tone : frame) {
            writeTone(out, offset, n, profile.toneFrequencyHz(tone));
            offset += n;
        }
        LOG.debug("Modulated {} bytes with {} into {} samples", payload.length, profile, out.length);
        return out;
    }

    private void writeTone(short[] out, int offset, int length, double frequencyHz) {
        double step = 2.0 * Math.PI * frequencyHz / AudioFormat.MODEM_SAMPLE_RATE;
        for (int i = 0; i < length; i++) {
            out[offset + i] = (short) Math.round(amplitude * Math.sin(step * i));
        }
    }

    @Override
    public Optional<DecodedFrame> feed(short[] samples, int offset, int length) {
        ensureOpen();
        Objects.checkFromIndexSize(offset, length, samples.length);
        accumulator.append(samples, offset, length);

        long keepFrom = Long.MAX_VALUE;
        for (PreambleScanner scanner : scanners) {
            Optional<byte[]> payload = scanner.scan(accumulator);
            if (payload.isPresent()) {
                TransmissionProfile profile = scanner.profile();
                LOG.debug("Frame of {} bytes found with {}", payload.get().length, profile);
                reset();
                return Optional.of(new DecodedFrame(payload.get(), profile));
            }
            keepFrom = Math.min(keepFrom, scanner.earliestNeeded());
        }
        accumulator.discardBefore(keepFrom);
        return Optional.empty();
    }

    @Override
    public void reset() {
        accumulator.clear();
        for (PreambleScanner scanner : scanners) {
            scanner.reset();
        }
    }

    @Override
    public String getModemName() {
        return MODEM_NAME;
    }

    /**
     * Marks the instance unusable. A thread still inside {@link #feed} fails on its next call.
     */
    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(MODEM_NAME + " modem instance is closed");
        }
    }
}
