package com.phillippitts.audiolink.testutil;

import com.phillippitts.audiolink.config.properties.ModemProperties;
import com.phillippitts.audiolink.domain.SampleBuffer;
import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.service.audio.AudioFormat;
import com.phillippitts.audiolink.service.metrics.ModemMetrics;
import com.phillippitts.audiolink.service.modem.ModemAdapter;
import com.phillippitts.audiolink.service.modem.ModemPool;
import com.phillippitts.audiolink.service.modem.fsk.MultiToneFskModem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Builders shared by modem, pipeline and controller tests.
 */
public final class ModemTestSupport {

    public static final int DEFAULT_VOLUME = 50;

    private ModemTestSupport() {
    }

    public static ModemProperties properties() {
        ModemProperties props = new ModemProperties();
        props.setAcquireTimeoutMs(5_000);
        props.setDecodeTimeoutMs(10_000);
        return props;
    }

    public static ThreadPoolTaskExecutor executor(int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("test-modem-");
        executor.initialize();
        return executor;
    }

    public static ModemPool realPool(int size) {
        return new ModemPool(size, 5_000, () -> new MultiToneFskModem(DEFAULT_VOLUME));
    }

    public static ModemAdapter adapter(ModemPool pool, ThreadPoolTaskExecutor executor, ModemProperties props) {
        return new ModemAdapter(pool, executor, props, new ModemMetrics(new SimpleMeterRegistry()));
    }

    /**
     * Modulates text directly with a fresh modem instance.
     */
    public static SampleBuffer modulated(String text, TransmissionProfile profile) {
        MultiToneFskModem modem = new MultiToneFskModem(DEFAULT_VOLUME);
        short[] samples = modem.modulate(text.getBytes(StandardCharsets.UTF_8), profile);
        return SampleBuffer.wrap(samples, AudioFormat.MODEM_SAMPLE_RATE, AudioFormat.MODEM_BITS_PER_SAMPLE);
    }

    public static SampleBuffer silence(int samples) {
        return SampleBuffer.wrap(new short[samples], AudioFormat.MODEM_SAMPLE_RATE, AudioFormat.MODEM_BITS_PER_SAMPLE);
    }

    /**
     * Gaussian noise with the given standard deviation, from a fixed seed.
     */
    public static short[] noise(int samples, double sigma, long seed) {
        Random random = new Random(seed);
        short[] out = new short[samples];
        for (int i = 0; i < samples; i++) {
            double v = random.nextGaussian() * sigma;
            out[i] = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, Math.round(v)));
        }
        return out;
    }
}
