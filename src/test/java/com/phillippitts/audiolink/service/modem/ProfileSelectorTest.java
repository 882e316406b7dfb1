package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.config.properties.ModemProperties;
import com.phillippitts.audiolink.domain.Payload;
import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.exception.InvalidRequestException;
import com.phillippitts.audiolink.exception.PayloadTooLargeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileSelectorTest {

    private ModemProperties properties;
    private ProfileSelector selector;

    @BeforeEach
    void setUp() {
        properties = new ModemProperties();
        selector = new ProfileSelector(properties);
    }

    private static Payload bytes(int n) {
        return Payload.ofBytes(new byte[n]);
    }

    @Test
    void shortPayloadUsesDefaultProfile() {
        assertThat(selector.select(Payload.ofText("Hello"), null)).isEqualTo(TransmissionProfile.AUDIBLE_NORMAL);
        assertThat(selector.select(Payload.empty(), " ")).isEqualTo(TransmissionProfile.AUDIBLE_NORMAL);
    }

    @Test
    void longerPayloadStepsToFasterProfileInSameBand() {
        assertThat(selector.select(bytes(300), null)).isEqualTo(TransmissionProfile.AUDIBLE_FAST);

        properties.setDefaultProfile(TransmissionProfile.ULTRASOUND_NORMAL);
        assertThat(selector.select(bytes(300), null)).isEqualTo(TransmissionProfile.ULTRASOUND_FAST);
    }

    @Test
    void payloadAboveGlobalCeilingIsRejected() {
        assertThatThrownBy(() -> selector.select(bytes(1_025), null))
                .isInstanceOfSatisfying(PayloadTooLargeException.class, ex -> {
                    assertThat(ex.getPayloadBytes()).isEqualTo(1_025);
                    assertThat(ex.getMaxBytes()).isEqualTo(1_024);
                });
    }

    @Test
    void payloadAtCeilingIsAccepted() {
        assertThat(selector.select(bytes(1_024), null)).isEqualTo(TransmissionProfile.AUDIBLE_FAST);
    }

    @Test
    void requestedProfileIsUsedWhenPayloadFits() {
        assertThat(selector.select(bytes(10), "ultrasound-fastest")).isEqualTo(TransmissionProfile.ULTRASOUND_FASTEST);
    }

    @Test
    void requestedProfileIsNotUpgraded() {
        assertThatThrownBy(() -> selector.select(bytes(300), "audible_normal"))
                .isInstanceOfSatisfying(PayloadTooLargeException.class,
                        ex -> assertThat(ex.getMaxBytes()).isEqualTo(256));
    }

    @Test
    void unknownProfileIsInvalidRequest() {
        assertThatThrownBy(() -> selector.select(bytes(1), "loud"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("'loud'")
                .hasMessageContaining("AUDIBLE_FAST");
    }

    @Test
    void effectiveCeilingHonoursGlobalLimit() {
        properties.setMaxPayloadBytes(100);

        assertThat(selector.effectiveCeiling(TransmissionProfile.AUDIBLE_NORMAL)).isEqualTo(100);
        assertThatThrownBy(() -> selector.select(bytes(101), null)).isInstanceOf(PayloadTooLargeException.class);
    }
}
