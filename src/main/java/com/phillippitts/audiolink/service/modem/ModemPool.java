package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.exception.ModemUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Fixed-size pool of {@link AcousticModem} instances, the only place modem state lives.
 *
 * <p>Borrowers wait at most the configured acquire timeout, then fail with
 * {@link ModemUnavailableException}. A pool of size 1 behaves as a global mutex.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * AcousticModem modem = pool.borrow("modulate");
 * try {
 *     // ... use modem ...
 *     pool.giveBack(modem);
 * } catch (RuntimeException e) {
 *     pool.discard(modem);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>An instance whose state can no longer be trusted (timed out mid-decode, threw from the
 * modem) must be {@linkplain #discard discarded}: it is closed and a fresh instance from the
 * factory takes its slot.
 */
public class ModemPool implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ModemPool.class);

    private final int size;
    private final long acquireTimeoutMs;
    private final Supplier<? extends AcousticModem> factory;
    private final BlockingQueue<AcousticModem> idle;
    private final AtomicLong replacements = new AtomicLong();
    private volatile boolean closed;

    /**
     * @param size             number of instances (must be positive)
     * @param acquireTimeoutMs maximum wait in {@link #borrow}
     * @param factory          creates instances at startup and as replacements
     */
    public ModemPool(int size, long acquireTimeoutMs, Supplier<? extends AcousticModem> factory) {
        if (size <= 0) {
            throw new IllegalArgumentException("Pool size must be positive, got: " + size);
        }
        if (acquireTimeoutMs < 0) {
            throw new IllegalArgumentException("Acquire timeout must not be negative, got: " + acquireTimeoutMs);
        }
        this.size = size;
        this.acquireTimeoutMs = acquireTimeoutMs;
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.idle = new ArrayBlockingQueue<>(size);
        for (int i = 0; i < size; i++) {
            idle.add(factory.get());
        }
        LOG.info("Modem pool ready: size={}, acquireTimeoutMs={}", size, acquireTimeoutMs);
    }

    /**
     * Takes an idle instance, waiting up to the acquire timeout.
     *
     * @param operation operation name for error messages
     * @throws ModemUnavailableException if none frees up in time, the thread is interrupted,
     *                                   or the pool is closed
     */
    public AcousticModem borrow(String operation) {
        if (closed) {
            throw new ModemUnavailableException(operation, 0);
        }
        try {
            AcousticModem modem = idle.poll(acquireTimeoutMs, TimeUnit.MILLISECONDS);
            if (modem == null) {
                LOG.warn("No modem instance free after {}ms (operation={})", acquireTimeoutMs, operation);
                throw new ModemUnavailableException(operation, acquireTimeoutMs);
            }
            return modem;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModemUnavailableException(operation, e);
        }
    }

    /**
     * Resets a healthy instance and returns it to the pool.
     */
    public void giveBack(AcousticModem modem) {
        Objects.requireNonNull(modem, "modem must not be null");
        try {
            modem.reset();
        } catch (RuntimeException e) {
            LOG.warn("Modem reset failed, replacing instance", e);
            discard(modem);
            return;
        }
        if (closed || !idle.offer(modem)) {
            modem.close();
        }
    }

    /**
     * Closes an untrusted instance and fills its slot with a new one.
     */
    public void discard(AcousticModem modem) {
        Objects.requireNonNull(modem, "modem must not be null");
        try {
            modem.close();
        } catch (RuntimeException e) {
            LOG.warn("Closing discarded modem instance failed", e);
        }
        if (closed) {
            return;
        }
        replacements.incrementAndGet();
        if (!idle.offer(factory.get())) {
            LOG.error("Modem pool already full while replacing a discarded instance");
        }
    }

    public int size() {
        return size;
    }

    public int available() {
        return idle.size();
    }

    public long replacements() {
        return replacements.get();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes every idle instance. Instances still borrowed are closed when given back.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<AcousticModem> drained = new ArrayList<>();
        idle.drainTo(drained);
        for (AcousticModem modem : drained) {
            try {
                modem.close();
            } catch (RuntimeException e) {
                LOG.warn("Closing modem instance failed during shutdown", e);
            }
        }
        LOG.info("Modem pool closed ({} idle instances released)", drained.size());
    }
}
