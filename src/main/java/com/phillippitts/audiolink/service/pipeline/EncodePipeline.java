package com.phillippitts.audiolink.service.pipeline;

import com.phillippitts.audiolink.domain.Payload;
import com.phillippitts.audiolink.domain.SampleBuffer;
import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.exception.InvalidRequestException;
import com.phillippitts.audiolink.service.audio.AudioFormat;
import com.phillippitts.audiolink.service.audio.WavCodec;
import com.phillippitts.audiolink.service.modem.ModemAdapter;
import com.phillippitts.audiolink.service.modem.ProfileSelector;
import com.phillippitts.audiolink.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

/**
 * Text to WAV: validate, select a profile, modulate, wrap in a container.
 *
 * <p>Payload size is checked before any modem call. Stateless.
 */
@Service
public class EncodePipeline {

    private static final Logger LOG = LogManager.getLogger(EncodePipeline.class);

    private final ProfileSelector profileSelector;
    private final ModemAdapter modemAdapter;
    private final WavCodec wavCodec;

    public EncodePipeline(ProfileSelector profileSelector, ModemAdapter modemAdapter, WavCodec wavCodec) {
        this.profileSelector = profileSelector;
        this.modemAdapter = modemAdapter;
        this.wavCodec = wavCodec;
    }

    /**
     * @param text        message to send (may be empty, not null)
     * @param profileName requested profile, or null for auto-selection
     * @throws InvalidRequestException if text is null or the profile is unknown
     * @throws com.phillippitts.audiolink.exception.PayloadTooLargeException if the text does not fit
     * @throws com.phillippitts.audiolink.exception.ModemException if the modem is busy or fails
     */
    public EncodedAudio encode(String text, String profileName) {
        if (text == null) {
            throw new InvalidRequestException("Field 'text' is required.");
        }
        Payload payload = Payload.ofText(text);
        TransmissionProfile profile = profileSelector.select(payload, profileName);

        SampleBuffer samples = modemAdapter.modulate(payload, profile);
        byte[] wav = wavCodec.encode(samples);

        LOG.info("Encoded {} bytes with {} into {} byte WAV ({}ms)",
                payload.length(), profile, wav.length, samples.durationMillis());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Encoded text preview: '{}'", LogSanitizer.preview(text));
        }
        return new EncodedAudio(wav, AudioFormat.WAV_CONTENT_TYPE, profile, samples.durationMillis());
    }
}
