package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.domain.TransmissionProfile;

import java.util.Optional;

/**
 * Contract for data-over-sound modem implementations.
 *
 * <p>All samples exchanged with a modem use the format defined by
 * {@link com.phillippitts.audiolink.service.audio.AudioFormat}: 48kHz, 16-bit signed PCM, mono.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Instance is created by the {@link ModemPool} factory at startup</li>
 *   <li>{@link #modulate} and {@link #feed} are called by one borrower at a time</li>
 *   <li>{@link #reset()} is called before the instance goes back to the pool</li>
 *   <li>{@link #close()} releases the instance for good</li>
 * </ol>
 *
 * <p>Thread Safety: implementations are NOT required to be thread-safe. The pool guarantees
 * that at most one thread holds an instance.
 */
public interface AcousticModem extends AutoCloseable {

    /**
     * Turns a payload into a complete transmission (leading silence, preamble, frame, trailing silence).
     *
     * @param payload bytes to transmit (may be empty)
     * @param profile transmission profile to modulate with
     * @return 16-bit samples at 48kHz
     * @throws IllegalArgumentException if the payload exceeds the profile's ceiling
     */
    short[] modulate(byte[] payload, TransmissionProfile profile);

    /**
     * Appends samples to the receive state and reports a frame as soon as one completes.
     *
     * <p>After a frame is returned the receive state is reset, so the next call starts a fresh search.
     *
     * @param samples source array
     * @param offset  first sample to read
     * @param length  number of samples to read
     * @return the decoded frame, or empty if no complete frame has been seen yet
     */
    Optional<DecodedFrame> feed(short[] samples, int offset, int length);

    /**
     * Discards all receive state. Called between borrowers.
     */
    void reset();

    /**
     * @return short name for logs and metrics
     */
    String getModemName();

    @Override
    void close();
}
