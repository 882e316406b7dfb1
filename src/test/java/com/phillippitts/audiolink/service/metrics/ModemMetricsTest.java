package com.phillippitts.audiolink.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ModemMetricsTest {

    private MeterRegistry registry;
    private ModemMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ModemMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerOperationAndProfile() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordLatency("demodulate", "AUDIBLE_FAST", durationNanos);

        Timer timer = registry.find("audiolink.modem.latency")
                .tag("operation", "demodulate")
                .tag("profile", "AUDIBLE_FAST")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldKeepProfilesApart() {
        metrics.recordLatency("modulate", "AUDIBLE_NORMAL", 1_000);
        metrics.recordLatency("modulate", "AUDIBLE_NORMAL", 1_000);
        metrics.recordLatency("modulate", ModemMetrics.UNKNOWN_PROFILE, 1_000);

        assertThat(registry.find("audiolink.modem.latency").tag("profile", "AUDIBLE_NORMAL").timer().count())
                .isEqualTo(2);
        assertThat(registry.find("audiolink.modem.latency").tag("profile", "none").timer().count())
                .isEqualTo(1);
    }

    @Test
    void shouldCountOutcomes() {
        metrics.incrementOutcome("demodulate", "decoded");
        metrics.incrementOutcome("demodulate", "decoded");
        metrics.incrementOutcome("demodulate", "decode_timeout");

        Counter decoded = registry.find("audiolink.modem.outcome").tag("outcome", "decoded").counter();
        Counter timeout = registry.find("audiolink.modem.outcome").tag("outcome", "decode_timeout").counter();
        assertThat(decoded).isNotNull();
        assertThat(decoded.count()).isEqualTo(2.0);
        assertThat(timeout.count()).isEqualTo(1.0);
    }
}
