package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.domain.DecodeResult;
import com.phillippitts.audiolink.domain.ErrorKind;
import com.phillippitts.audiolink.domain.Payload;
import com.phillippitts.audiolink.domain.SampleBuffer;
import com.phillippitts.audiolink.exception.ModemExceptionBuilder;
import com.phillippitts.audiolink.service.audio.AudioFormat;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds one borrowed modem instance across successive {@link #feed} calls, so that a message
 * split over many chunks is recovered as it arrives.
 *
 * <p>Runs on the caller's thread with no timeout. Not thread-safe. Always close it (the
 * instance goes back to the pool, or is replaced if the modem failed).
 */
public final class DemodulationSession implements AutoCloseable {

    private final ModemPool pool;
    private final AcousticModem modem;
    private boolean broken;
    private boolean closed;

    DemodulationSession(ModemPool pool, AcousticModem modem) {
        this.pool = pool;
        this.modem = modem;
    }

    /**
     * Feeds one chunk.
     *
     * @return {@code decoded(...)} once a frame completes, otherwise {@code noSignal()} meaning
     *         "nothing yet"; after a decoded result the session starts a fresh search
     * @throws IllegalArgumentException if the chunk is not at the modem sample rate
     * @throws com.phillippitts.audiolink.exception.ModemException if the modem fails
     */
    public DecodeResult feed(SampleBuffer chunk) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
        if (chunk.sampleRate() != AudioFormat.MODEM_SAMPLE_RATE) {
            throw new IllegalArgumentException("Chunk sample rate " + chunk.sampleRate()
                    + "Hz does not match modem rate " + AudioFormat.MODEM_SAMPLE_RATE + "Hz");
        }
        short[] pcm = chunk.toPcm16().samples();
        Optional<DecodedFrame> frame;
        try {
            frame = modem.feed(pcm, 0, pcm.length);
        } catch (RuntimeException e) {
            broken = true;
            throw ModemExceptionBuilder.create("Streaming demodulation failed")
                    .kind(ErrorKind.INTERNAL_ERROR)
                    .operation("session-feed")
                    .cause(e)
                    .metadata("modem", modem.getModemName())
                    .metadata("samples", pcm.length)
                    .build();
        }
        return frame
                .map(f -> DecodeResult.decoded(Payload.ofBytes(f.payload()), f.profile()))
                .orElseGet(DecodeResult::noSignal);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (broken) {
            pool.discard(modem);
        } else {
            pool.giveBack(modem);
        }
    }
}
