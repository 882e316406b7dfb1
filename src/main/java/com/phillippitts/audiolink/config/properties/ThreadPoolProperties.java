package com.phillippitts.audiolink.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Only the modem executor exists today; it runs demodulation so that it can be timed out.
 * Its queue is bounded: when pool and queue are full, decode requests fail fast with
 * {@code MODEM_UNAVAILABLE}.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private ModemPoolProperties modem = new ModemPoolProperties();

    public ModemPoolProperties getModem() {
        return modem;
    }

    public void setModem(ModemPoolProperties modem) {
        this.modem = modem;
    }

    /**
     * Modem executor pool configuration.
     */
    public static class ModemPoolProperties {
        @Positive
        private int corePoolSize = 4;
        @Positive
        private int maxPoolSize = 8;
        @PositiveOrZero
        private int queueCapacity = 32;
        @Positive
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "modem-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
