package com.phillippitts.audiolink;

import com.phillippitts.audiolink.service.audio.WavCodec;
import com.phillippitts.audiolink.testutil.ModemTestSupport;
import com.phillippitts.audiolink.testutil.WavTestBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AudioLinkApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WavCodec wavCodec;

    private MvcResult encode(String json) throws Exception {
        return mockMvc.perform(post("/encode").contentType(MediaType.APPLICATION_JSON).content(json))
                .andReturn();
    }

    private static MockMultipartFile wavFile(byte[] bytes) {
        return new MockMultipartFile("file", "link.wav", "audio/wav", bytes);
    }

    @Test
    void encodedWavDecodesToOriginalText() throws Exception {
        MvcResult encoded = mockMvc.perform(post("/encode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("audio/wav"))
                .andExpect(header().string("Content-Disposition", containsString("filename=\"link.wav\"")))
                .andExpect(header().string("X-AudioLink-Profile", "AUDIBLE_NORMAL"))
                .andReturn();
        byte[] wav = encoded.getResponse().getContentAsByteArray();

        assertThat(new String(wav, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
        mockMvc.perform(multipart("/decode").file(wavFile(wav)))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("Hello"))
                .andExpect(header().string("X-AudioLink-Profile", "AUDIBLE_NORMAL"));
    }

    @Test
    void unicodeTextSurvivesRoundTrip() throws Exception {
        MvcResult encoded = encode("{\"text\":\"héllo wörld ✓\",\"profile\":\"ultrasound-fast\"}");
        assertThat(encoded.getResponse().getStatus()).isEqualTo(200);

        MvcResult decoded = mockMvc.perform(multipart("/decode")
                        .file(wavFile(encoded.getResponse().getContentAsByteArray())))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(decoded.getResponse().getContentAsString(StandardCharsets.UTF_8)).isEqualTo("héllo wörld ✓");
    }

    @Test
    void emptyTextIsEncodable() throws Exception {
        MvcResult encoded = encode("{\"text\":\"\"}");
        assertThat(encoded.getResponse().getStatus()).isEqualTo(200);

        mockMvc.perform(multipart("/decode").file(wavFile(encoded.getResponse().getContentAsByteArray())))
                .andExpect(status().isOk())
                .andExpect(content().string(""));
    }

    @Test
    void missingTextIsBadRequest() throws Exception {
        mockMvc.perform(post("/encode").contentType(MediaType.APPLICATION_JSON).content("{\"profile\":\"audible-fast\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.detail").value("Field 'text' is required."));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/encode").contentType(MediaType.APPLICATION_JSON).content("{\"text\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void unknownProfileIsBadRequest() throws Exception {
        mockMvc.perform(post("/encode").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hi\",\"profile\":\"subsonic\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("subsonic")));
    }

    @Test
    void oversizedTextIsPayloadTooLarge() throws Exception {
        String text = "x".repeat(1_025);

        mockMvc.perform(post("/encode").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"" + text + "\"}"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.errorCode").value("PAYLOAD_TOO_LARGE"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void oversizedEncodeBodyIsRefusedBeforeBinding() throws Exception {
        String text = "x".repeat(70_000);

        mockMvc.perform(post("/encode").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"" + text + "\"}"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.errorCode").value("PAYLOAD_TOO_LARGE"))
                .andExpect(jsonPath("$.detail").value(containsString("Request body too large")));
    }

    @Test
    void garbageUploadIsMalformed() throws Exception {
        mockMvc.perform(multipart("/decode").file(wavFile("0123456789".getBytes(StandardCharsets.US_ASCII))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MALFORMED_CONTAINER"));
    }

    @Test
    void emptyUploadIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/decode").file(wavFile(new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("EMPTY_UPLOAD"))
                .andExpect(jsonPath("$.detail").value("Uploaded WAV file was empty."));
    }

    @Test
    void silentRecordingIsUnprocessable() throws Exception {
        byte[] wav = wavCodec.encode(ModemTestSupport.silence(48_000));

        mockMvc.perform(multipart("/decode").file(wavFile(wav)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("NO_SIGNAL_DETECTED"));
    }

    @Test
    void stereoUploadIsUnsupportedMediaType() throws Exception {
        byte[] wav = WavTestBuilder.riff().fmt(1, 2, 48_000, 16).data16(new short[200]).build();

        mockMvc.perform(multipart("/decode").file(wavFile(wav)))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.errorCode").value("UNSUPPORTED_CHANNEL_LAYOUT"));
    }

    @Test
    void missingFilePartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/decode").file(new MockMultipartFile("upload", new byte[]{1})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("'file'")));
    }

    @Test
    void healthReportsPool() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.modemPoolSize").value(2));
    }

    @Test
    void actuatorHealthIncludesModemPool() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.modem.details.poolSize").value(2));
    }

    @Test
    void profilesListsEveryProfile() throws Exception {
        mockMvc.perform(get("/profiles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)))
                .andExpect(jsonPath("$[0].name").value("AUDIBLE_NORMAL"))
                .andExpect(jsonPath("$[0].isDefault").value(true))
                .andExpect(jsonPath("$[0].maxPayloadBytes").value(256))
                .andExpect(jsonPath("$[2].maxPayloadBytes").value(1_024));
    }

    @Test
    void wrongMethodKeepsItsStatus() throws Exception {
        mockMvc.perform(get("/encode")).andExpect(status().isMethodNotAllowed());
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/health").header("X-Request-ID", "trace-abc"))
                .andExpect(header().string("X-Request-ID", "trace-abc"));
    }

    @Test
    void corsPreflightAllowsConfiguredOrigin() throws Exception {
        mockMvc.perform(options("/encode")
                        .header("Origin", "http://localhost:5173")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:5173"))
                .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
    }
}
