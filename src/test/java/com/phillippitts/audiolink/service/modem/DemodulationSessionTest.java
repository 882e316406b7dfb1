package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.domain.DecodeResult;
import com.phillippitts.audiolink.domain.ErrorKind;
import com.phillippitts.audiolink.domain.SampleBuffer;
import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.exception.ModemException;
import com.phillippitts.audiolink.testutil.FakeModem;
import com.phillippitts.audiolink.testutil.ModemTestSupport;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DemodulationSessionTest {

    @Test
    void reportsNothingYetUntilFrameCompletes() {
        ModemPool pool = new ModemPool(1, 100, FakeModem::new);
        DemodulationSession session = new DemodulationSession(pool, pool.borrow("session"));

        assertThat(session.feed(ModemTestSupport.silence(100)).isNoSignal()).isTrue();
    }

    @Test
    void returnsDecodedFrame() {
        ModemPool pool = new ModemPool(1, 100,
                () -> new FakeModem().answering("hi".getBytes(StandardCharsets.UTF_8), TransmissionProfile.AUDIBLE_FAST));
        DemodulationSession session = new DemodulationSession(pool, pool.borrow("session"));

        DecodeResult result = session.feed(ModemTestSupport.silence(10));

        assertThat(result.text()).isEqualTo("hi");
        assertThat(result.profile()).isEqualTo(TransmissionProfile.AUDIBLE_FAST);
    }

    @Test
    void widensEightBitChunks() {
        ModemPool pool = new ModemPool(1, 100, FakeModem::new);
        DemodulationSession session = new DemodulationSession(pool, pool.borrow("session"));

        assertThat(session.feed(SampleBuffer.wrap(new short[]{1, -1}, 48_000, 8)).isNoSignal()).isTrue();
    }

    @Test
    void rejectsChunkAtOtherSampleRate() {
        ModemPool pool = new ModemPool(1, 100, FakeModem::new);
        DemodulationSession session = new DemodulationSession(pool, pool.borrow("session"));

        assertThatThrownBy(() -> session.feed(SampleBuffer.wrap(new short[10], 8_000, 16)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("8000");
    }

    @Test
    void closeReturnsHealthyInstance() {
        ModemPool pool = new ModemPool(1, 100, FakeModem::new);
        FakeModem modem = (FakeModem) pool.borrow("session");
        DemodulationSession session = new DemodulationSession(pool, modem);

        session.close();
        session.close();

        assertThat(modem.resets()).isEqualTo(1);
        assertThat(pool.available()).isEqualTo(1);
        assertThatThrownBy(() -> session.feed(ModemTestSupport.silence(1))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failingModemIsReplacedOnClose() {
        ModemPool pool = new ModemPool(1, 100, () -> new FakeModem().failingFeed(new IllegalStateException("bad")));
        FakeModem modem = (FakeModem) pool.borrow("session");
        DemodulationSession session = new DemodulationSession(pool, modem);

        assertThatThrownBy(() -> session.feed(ModemTestSupport.silence(10)))
                .isInstanceOfSatisfying(ModemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
                    assertThat(ex.getOperation()).isEqualTo("session-feed");
                });
        session.close();

        assertThat(modem.isClosed()).isTrue();
        assertThat(pool.replacements()).isEqualTo(1);
    }
}
