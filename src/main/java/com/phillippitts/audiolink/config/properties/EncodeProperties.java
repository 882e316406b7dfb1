package com.phillippitts.audiolink.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request limits for the encode endpoint.
 *
 * <p>{@code max-request-bytes} bounds the raw JSON body and is checked against the declared
 * {@code Content-Length} before the body is read. It must leave room for the payload ceiling
 * after JSON escaping.
 */
@ConfigurationProperties(prefix = "audiolink.encode")
@Validated
public class EncodeProperties {

    /** Largest accepted JSON body. Default: 64 KiB. */
    @Positive(message = "Maximum request size must be positive")
    private long maxRequestBytes = 64L * 1024;

    public long getMaxRequestBytes() {
        return maxRequestBytes;
    }

    public void setMaxRequestBytes(long maxRequestBytes) {
        this.maxRequestBytes = maxRequestBytes;
    }
}
