package com.phillippitts.audiolink.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Upload limits for the decode endpoint.
 *
 * <p>{@code spring.servlet.multipart.max-file-size} must stay above {@code max-bytes} so that
 * oversized uploads reach the decode pipeline and get its error detail.
 */
@ConfigurationProperties(prefix = "audiolink.upload")
@Validated
public class UploadProperties {

    /** Largest accepted WAV upload. Default: 10 MiB (about 100 s of 48kHz 16-bit mono). */
    @Positive(message = "Maximum upload size must be positive")
    private long maxBytes = 10L * 1024 * 1024;

    public long getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }
}
