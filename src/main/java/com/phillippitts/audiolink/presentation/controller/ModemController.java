package com.phillippitts.audiolink.presentation.controller;

import com.phillippitts.audiolink.domain.DecodeResult;
import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.exception.DecodeFailedException;
import com.phillippitts.audiolink.config.properties.ModemProperties;
import com.phillippitts.audiolink.service.modem.ProfileSelector;
import com.phillippitts.audiolink.service.pipeline.DecodePipeline;
import com.phillippitts.audiolink.service.pipeline.EncodePipeline;
import com.phillippitts.audiolink.service.pipeline.EncodedAudio;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * HTTP surface of the gateway: encode text to WAV, decode WAV to text, list profiles.
 *
 * <p>Failures surface as exceptions and are mapped to status codes by
 * {@link com.phillippitts.audiolink.presentation.exception.GlobalExceptionHandler}.
 */
@RestController
class ModemController {

    static final String PROFILE_HEADER = "X-AudioLink-Profile";
    static final String DURATION_HEADER = "X-AudioLink-Duration-Ms";
    static final String WAV_FILENAME = "link.wav";

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final EncodePipeline encodePipeline;
    private final DecodePipeline decodePipeline;
    private final ProfileSelector profileSelector;
    private final ModemProperties modemProperties;

    ModemController(EncodePipeline encodePipeline,
                    DecodePipeline decodePipeline,
                    ProfileSelector profileSelector,
                    ModemProperties modemProperties) {
        this.encodePipeline = encodePipeline;
        this.decodePipeline = decodePipeline;
        this.profileSelector = profileSelector;
        this.modemProperties = modemProperties;
    }

    @PostMapping(value = "/encode", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<byte[]> encode(@Valid @RequestBody EncodeRequest request) {
        EncodedAudio audio = encodePipeline.encode(request.text(), request.profile());
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(audio.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(WAV_FILENAME).build().toString())
                .header(PROFILE_HEADER, audio.profile().name())
                .header(DURATION_HEADER, String.valueOf(audio.durationMs()))
                .body(audio.wav());
    }

    @PostMapping(value = "/decode", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<String> decode(@RequestPart("file") MultipartFile file) throws IOException {
        DecodeResult result;
        try (InputStream in = file.getInputStream()) {
            result = decodePipeline.decode(file.getSize(), in);
        }
        if (!result.isDecoded()) {
            throw new DecodeFailedException(result);
        }
        return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .header(PROFILE_HEADER, result.profile().name())
                .body(result.text());
    }

    @GetMapping("/profiles")
    List<ProfileView> profiles() {
        return Arrays.stream(TransmissionProfile.values())
                .map(p -> new ProfileView(
                        p.name(),
                        p.band().name(),
                        p.samplesPerSymbol(),
                        p.baseFrequencyHz(),
                        p.toneSpacingHz(),
                        profileSelector.effectiveCeiling(p),
                        p == modemProperties.getDefaultProfile()))
                .toList();
    }

    /**
     * One entry of {@code GET /profiles}.
     */
    record ProfileView(
            String name,
            String band,
            int samplesPerSymbol,
            double baseFrequencyHz,
            double toneSpacingHz,
            int maxPayloadBytes,
            boolean isDefault
    ) {}
}
