package com.phillippitts.audiolink.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for modem operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Modulation and demodulation latency per profile</li>
 *   <li>Outcome counts per operation (decoded, no-signal, timeout, unavailable, error)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class ModemMetrics {

    private static final String METRIC_PREFIX = "audiolink.modem";

    /** Tag value when the profile is not known (no frame found, failure before selection). */
    public static final String UNKNOWN_PROFILE = "none";

    private final MeterRegistry registry;

    public ModemMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one modem operation.
     *
     * @param operation     modulate or demodulate
     * @param profile       profile name, or {@link #UNKNOWN_PROFILE}
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String operation, String profile, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time spent in modem operations")
                .tag("operation", operation)
                .tag("profile", profile)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts one outcome of a modem operation.
     *
     * @param operation modulate or demodulate
     * @param outcome   lower-case outcome name (success, decoded, no_signal_detected, ...)
     */
    public void incrementOutcome(String operation, String outcome) {
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of modem operations by outcome")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
