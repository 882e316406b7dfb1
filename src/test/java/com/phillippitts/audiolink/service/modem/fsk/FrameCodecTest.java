package com.phillippitts.audiolink.service.modem.fsk;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameCodecTest {

    @Test
    void shouldLayOutHeaderPayloadAndCrcAsNibbles() {
        int[] symbols = FrameCodec.toSymbols(new byte[]{(byte) 0xA5});

        assertThat(symbols).hasSize(FrameCodec.symbolCount(1));
        assertThat(symbols).startsWith(0, 0, 0, 1, 0xA, 0x5);
        assertThat(Arrays.stream(symbols).allMatch(s -> s >= 0 && s < 16)).isTrue();
    }

    @Test
    void shouldUnpackWhatItPacks() {
        byte[] payload = "Hello".getBytes(StandardCharsets.UTF_8);

        assertThat(FrameCodec.unpack(FrameCodec.toSymbols(payload))).hasValueSatisfying(
                bytes -> assertThat(bytes).isEqualTo(payload));
    }

    @Test
    void emptyPayloadStillCarriesHeaderAndCrc() {
        int[] symbols = FrameCodec.toSymbols(new byte[0]);

        assertThat(symbols).hasSize(FrameCodec.HEADER_SYMBOLS + FrameCodec.TRAILER_SYMBOLS);
        assertThat(FrameCodec.readLength(symbols)).isZero();
        assertThat(FrameCodec.unpack(symbols)).hasValueSatisfying(bytes -> assertThat(bytes).isEmpty());
    }

    @Test
    void shouldRejectCorruptedSymbol() {
        int[] symbols = FrameCodec.toSymbols("Hello".getBytes(StandardCharsets.UTF_8));
        symbols[6] ^= 0x1;

        assertThat(FrameCodec.unpack(symbols)).isEmpty();
    }

    @Test
    void shouldRejectLengthMismatch() {
        int[] symbols = FrameCodec.toSymbols(new byte[]{1, 2});
        symbols[3] = 3;

        assertThat(FrameCodec.unpack(symbols)).isEmpty();
    }

    @Test
    void shouldRejectOversizedPayload() {
        assertThatThrownBy(() -> FrameCodec.toSymbols(new byte[FrameCodec.MAX_FRAME_PAYLOAD + 1]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
