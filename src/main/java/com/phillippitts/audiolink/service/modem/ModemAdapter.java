package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.config.properties.ModemProperties;
import com.phillippitts.audiolink.domain.DecodeResult;
import com.phillippitts.audiolink.domain.ErrorKind;
import com.phillippitts.audiolink.domain.Payload;
import com.phillippitts.audiolink.domain.SampleBuffer;
import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.exception.ModemException;
import com.phillippitts.audiolink.exception.ModemExceptionBuilder;
import com.phillippitts.audiolink.exception.ModemUnavailableException;
import com.phillippitts.audiolink.service.audio.AudioFormat;
import com.phillippitts.audiolink.service.metrics.ModemMetrics;
import com.phillippitts.audiolink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The only gateway to {@link AcousticModem} instances.
 *
 * <p>Modulation runs on the caller's thread. Demodulation is handed to the
 * {@code modemExecutor} and awaited with the configured decode timeout; the worker feeds the
 * samples in chunks of {@code audiolink.modem.feed-chunk-samples} and stops at the first frame.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>{@link #modulate} throws {@link ModemException} (unavailable or internal)</li>
 *   <li>{@link #demodulate} never throws for modem failures; it returns a failed
 *       {@link DecodeResult} and logs the cause</li>
 *   <li>An instance that timed out or threw is discarded, never returned to the pool</li>
 * </ul>
 */
@Service
public class ModemAdapter {

    private static final Logger LOG = LogManager.getLogger(ModemAdapter.class);

    static final String OP_MODULATE = "modulate";
    static final String OP_DEMODULATE = "demodulate";

    static final String UNAVAILABLE_DETAIL = "All modem instances are busy. Please retry shortly.";
    static final String INTERNAL_DETAIL = "The audio could not be processed due to an internal error.";

    private final ModemPool pool;
    private final AsyncTaskExecutor executor;
    private final ModemProperties properties;
    private final ModemMetrics metrics;

    public ModemAdapter(ModemPool pool,
                        @Qualifier("modemExecutor") AsyncTaskExecutor executor,
                        ModemProperties properties,
                        ModemMetrics metrics) {
        this.pool = pool;
        this.executor = executor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Modulates a payload into 48kHz 16-bit samples.
     *
     * @throws ModemUnavailableException if no instance frees up in time
     * @throws ModemException            if the modem fails
     */
    public SampleBuffer modulate(Payload payload, TransmissionProfile profile) {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        long start = System.nanoTime();
        AcousticModem modem;
        try {
            modem = pool.borrow(OP_MODULATE);
        } catch (ModemUnavailableException e) {
            metrics.incrementOutcome(OP_MODULATE, outcome(ErrorKind.MODEM_UNAVAILABLE));
            throw e;
        }

        short[] samples;
        try {
            samples = modem.modulate(payload.bytes(), profile);
        } catch (RuntimeException e) {
            pool.discard(modem);
            metrics.incrementOutcome(OP_MODULATE, outcome(ErrorKind.INTERNAL_ERROR));
            throw ModemExceptionBuilder.create("Modulation failed")
                    .operation(OP_MODULATE)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("modem", modem.getModemName())
                    .metadata("profile", profile)
                    .metadata("payloadBytes", payload.length())
                    .build();
        }
        pool.giveBack(modem);

        metrics.recordLatency(OP_MODULATE, profile.name(), TimeUtils.elapsedNanos(start));
        metrics.incrementOutcome(OP_MODULATE, "success");
        LOG.debug("Modulated {} bytes with {} in {}ms", payload.length(), profile, TimeUtils.elapsedMillis(start));
        return SampleBuffer.wrap(samples, AudioFormat.MODEM_SAMPLE_RATE, AudioFormat.MODEM_BITS_PER_SAMPLE);
    }

    /**
     * Demodulates a complete buffer.
     *
     * @return {@code decoded} on the first valid frame, {@code noSignal} when the buffer is
     *         consumed without one, otherwise a failure ({@code MALFORMED_CONTAINER} for a
     *         sample-rate mismatch, {@code MODEM_UNAVAILABLE}, {@code DECODE_TIMEOUT},
     *         {@code INTERNAL_ERROR})
     */
    public DecodeResult demodulate(SampleBuffer samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.sampleRate() != AudioFormat.MODEM_SAMPLE_RATE) {
            return DecodeResult.failed(ErrorKind.MALFORMED_CONTAINER, "Unsupported sample rate "
                    + samples.sampleRate() + "Hz; audio must be " + AudioFormat.MODEM_SAMPLE_RATE + "Hz.");
        }
        long start = System.nanoTime();
        DecodeResult result = runDemodulation(samples.toPcm16().samples());
        String profile = result.isDecoded() ? result.profile().name() : ModemMetrics.UNKNOWN_PROFILE;
        metrics.recordLatency(OP_DEMODULATE, profile, TimeUtils.elapsedNanos(start));
        metrics.incrementOutcome(OP_DEMODULATE, result.isDecoded() ? "decoded" : outcome(result.failure()));
        return result;
    }

    private DecodeResult runDemodulation(short[] pcm) {
        AcousticModem modem;
        try {
            modem = pool.borrow(OP_DEMODULATE);
        } catch (ModemUnavailableException e) {
            return DecodeResult.failed(ErrorKind.MODEM_UNAVAILABLE, UNAVAILABLE_DETAIL);
        }

        Future<Optional<DecodedFrame>> future;
        try {
            future = executor.submit(() -> feedAll(modem, pcm));
        } catch (RejectedExecutionException e) {
            pool.giveBack(modem);
            LOG.warn("Modem executor saturated, rejecting demodulation of {} samples", pcm.length);
            return DecodeResult.failed(ErrorKind.MODEM_UNAVAILABLE, UNAVAILABLE_DETAIL);
        }

        long timeoutMs = properties.getDecodeTimeoutMs();
        try {
            Optional<DecodedFrame> frame = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            pool.giveBack(modem);
            return frame
                    .map(f -> DecodeResult.decoded(Payload.ofBytes(f.payload()), f.profile()))
                    .orElseGet(DecodeResult::noSignal);
        } catch (TimeoutException e) {
            future.cancel(true);
            pool.discard(modem);
            LOG.warn("Demodulation of {} samples timed out after {}ms; instance replaced", pcm.length, timeoutMs);
            return DecodeResult.failed(ErrorKind.DECODE_TIMEOUT,
                    "Decoding did not finish within " + timeoutMs + "ms.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            pool.discard(modem);
            LOG.warn("Interrupted while waiting for demodulation");
            return DecodeResult.failed(ErrorKind.INTERNAL_ERROR, INTERNAL_DETAIL);
        } catch (ExecutionException e) {
            pool.discard(modem);
            LOG.error("Demodulation failed in modem {}", modem.getModemName(), e.getCause());
            return DecodeResult.failed(ErrorKind.INTERNAL_ERROR, INTERNAL_DETAIL);
        }
    }

    private Optional<DecodedFrame> feedAll(AcousticModem modem, short[] pcm) {
        int chunk = properties.getFeedChunkSamples();
        for (int offset = 0; offset < pcm.length; offset += chunk) {
            if (Thread.currentThread().isInterrupted()) {
                return Optional.empty();
            }
            Optional<DecodedFrame> frame = modem.feed(pcm, offset, Math.min(chunk, pcm.length - offset));
            if (frame.isPresent()) {
                return frame;
            }
        }
        return Optional.empty();
    }

    /**
     * Opens a streaming session holding one instance until closed.
     *
     * @throws ModemUnavailableException if no instance frees up in time
     */
    public DemodulationSession openSession() {
        return new DemodulationSession(pool, pool.borrow("session"));
    }

    private static String outcome(ErrorKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
