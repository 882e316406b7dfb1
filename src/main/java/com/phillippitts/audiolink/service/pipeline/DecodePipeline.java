package com.phillippitts.audiolink.service.pipeline;

import com.phillippitts.audiolink.config.properties.UploadProperties;
import com.phillippitts.audiolink.domain.DecodeResult;
import com.phillippitts.audiolink.domain.ErrorKind;
import com.phillippitts.audiolink.domain.SampleBuffer;
import com.phillippitts.audiolink.exception.MalformedContainerException;
import com.phillippitts.audiolink.exception.UploadRejectedException;
import com.phillippitts.audiolink.service.audio.AudioFormat;
import com.phillippitts.audiolink.service.audio.WavCodec;
import com.phillippitts.audiolink.service.modem.ModemAdapter;
import com.phillippitts.audiolink.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Upload to text: check size, parse the container, demodulate, classify.
 *
 * <p>Every call returns a {@link DecodeResult}; codec and modem exceptions are converted to
 * tagged failures here. Size checks run on the declared size before anything is read, and
 * again on the bytes actually read, which never exceed {@code max-bytes + 1}.
 */
@Service
public class DecodePipeline {

    private static final Logger LOG = LogManager.getLogger(DecodePipeline.class);

    private final UploadProperties uploadProperties;
    private final WavCodec wavCodec;
    private final ModemAdapter modemAdapter;

    public DecodePipeline(UploadProperties uploadProperties, WavCodec wavCodec, ModemAdapter modemAdapter) {
        this.uploadProperties = uploadProperties;
        this.wavCodec = wavCodec;
        this.modemAdapter = modemAdapter;
    }

    /**
     * @param declaredSize size reported by the transport, or -1 when unknown
     * @param content      upload stream; read but not closed
     */
    public DecodeResult decode(long declaredSize, InputStream content) {
        Objects.requireNonNull(content, "content must not be null");
        long maxBytes = uploadProperties.getMaxBytes();
        if (declaredSize > maxBytes) {
            return reject(UploadRejectedException.tooLarge(declaredSize, maxBytes));
        }
        if (declaredSize == 0) {
            return reject(UploadRejectedException.empty());
        }

        byte[] bytes;
        try {
            bytes = content.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, maxBytes + 1));
        } catch (IOException e) {
            LOG.warn("Failed to read upload stream", e);
            return DecodeResult.failed(ErrorKind.INVALID_REQUEST, "Could not read the uploaded file.");
        }
        return decode(bytes);
    }

    /**
     * Decodes an upload already held in memory.
     */
    public DecodeResult decode(byte[] upload) {
        Objects.requireNonNull(upload, "upload must not be null");
        long maxBytes = uploadProperties.getMaxBytes();
        if (upload.length > maxBytes) {
            return reject(UploadRejectedException.tooLarge(upload.length, maxBytes));
        }
        if (upload.length == 0) {
            return reject(UploadRejectedException.empty());
        }

        SampleBuffer samples;
        try {
            samples = wavCodec.decode(upload);
        } catch (MalformedContainerException e) {
            LOG.debug("Rejected upload: kind={}, size={}, reason={}", e.getKind(), e.getContainerSize(), e.getReason());
            return DecodeResult.failed(e.getKind(), e.getMessage());
        }
        if (samples.sampleRate() != AudioFormat.MODEM_SAMPLE_RATE) {
            LOG.debug("Rejected upload: sample rate {}Hz", samples.sampleRate());
            return DecodeResult.failed(ErrorKind.MALFORMED_CONTAINER, "Unsupported sample rate "
                    + samples.sampleRate() + "Hz; audio must be " + AudioFormat.MODEM_SAMPLE_RATE + "Hz.");
        }

        DecodeResult result = modemAdapter.demodulate(samples);
        if (result.isDecoded()) {
            LOG.info("Decoded {} bytes with {} from {}ms of audio",
                    result.payload().length(), result.profile(), samples.durationMillis());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Decoded text preview: '{}'", LogSanitizer.preview(result.text()));
            }
        } else if (result.isNoSignal()) {
            LOG.info("No transmission found in {}ms of audio", samples.durationMillis());
        } else {
            LOG.debug("Decode failed: kind={}, detail={}", result.failure(), result.detail());
        }
        return result;
    }

    private static DecodeResult reject(UploadRejectedException e) {
        LOG.debug("Rejected upload: kind={}, size={}", e.getKind(), e.getUploadSize());
        return DecodeResult.failed(e.getKind(), e.getMessage());
    }
}
