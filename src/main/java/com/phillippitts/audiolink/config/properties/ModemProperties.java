package com.phillippitts.audiolink.config.properties;

import com.phillippitts.audiolink.domain.TransmissionProfile;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Modem pool sizing, timeouts and payload policy.
 *
 * <p>Properties:
 * <ul>
 *   <li>audiolink.modem.pool-size - independent modem instances (default: 4)</li>
 *   <li>audiolink.modem.acquire-timeout-ms - wait for a free instance (default: 2000)</li>
 *   <li>audiolink.modem.decode-timeout-ms - ceiling for one demodulation (default: 15000)</li>
 *   <li>audiolink.modem.feed-chunk-samples - samples per feed call (default: 4096)</li>
 *   <li>audiolink.modem.max-payload-bytes - global payload ceiling (default: 1024)</li>
 *   <li>audiolink.modem.default-profile - starting point of auto-selection (default: audible-normal)</li>
 *   <li>audiolink.modem.volume - output level in percent of full scale (default: 50)</li>
 * </ul>
 *
 * <p>Note: Bean created via {@link com.phillippitts.audiolink.AudioLinkApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "audiolink.modem")
@Validated
public class ModemProperties {

    @Positive(message = "Pool size must be positive")
    private int poolSize = 4;

    @Positive(message = "Acquire timeout must be positive")
    private long acquireTimeoutMs = 2000;

    @Positive(message = "Decode timeout must be positive")
    private long decodeTimeoutMs = 15_000;

    @Positive(message = "Feed chunk size must be positive")
    private int feedChunkSamples = 4096;

    /** Applied on top of each profile's own ceiling; the lower of the two wins. */
    @Positive(message = "Maximum payload size must be positive")
    private int maxPayloadBytes = 1024;

    @NotNull(message = "Default profile is required")
    private TransmissionProfile defaultProfile = TransmissionProfile.AUDIBLE_NORMAL;

    @Min(value = 1, message = "Volume must be at least 1")
    @Max(value = 100, message = "Volume must be at most 100")
    private int volume = 50;

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public long getDecodeTimeoutMs() {
        return decodeTimeoutMs;
    }

    public void setDecodeTimeoutMs(long decodeTimeoutMs) {
        this.decodeTimeoutMs = decodeTimeoutMs;
    }

    public int getFeedChunkSamples() {
        return feedChunkSamples;
    }

    public void setFeedChunkSamples(int feedChunkSamples) {
        this.feedChunkSamples = feedChunkSamples;
    }

    public int getMaxPayloadBytes() {
        return maxPayloadBytes;
    }

    public void setMaxPayloadBytes(int maxPayloadBytes) {
        this.maxPayloadBytes = maxPayloadBytes;
    }

    public TransmissionProfile getDefaultProfile() {
        return defaultProfile;
    }

    public void setDefaultProfile(TransmissionProfile defaultProfile) {
        this.defaultProfile = defaultProfile;
    }

    public int getVolume() {
        return volume;
    }

    public void setVolume(int volume) {
        this.volume = volume;
    }
}
