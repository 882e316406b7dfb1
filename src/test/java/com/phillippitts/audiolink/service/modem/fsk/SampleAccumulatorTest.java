package com.phillippitts.audiolink.service.modem.fsk;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleAccumulatorTest {

    @Test
    void keepsAbsolutePositionsAcrossDiscards() {
        SampleAccumulator acc = new SampleAccumulator();
        acc.append(new short[]{10, 11, 12, 13, 14}, 0, 5);

        acc.discardBefore(3);

        assertThat(acc.start()).isEqualTo(3);
        assertThat(acc.end()).isEqualTo(5);
        assertThat(acc.buffer()[acc.indexOf(4)]).isEqualTo((short) 14);
        assertThatThrownBy(() -> acc.indexOf(2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void growsBeyondInitialCapacity() {
        SampleAccumulator acc = new SampleAccumulator();
        short[] chunk = new short[50_000];
        chunk[49_999] = 7;

        acc.append(chunk, 0, chunk.length);
        acc.append(chunk, 0, chunk.length);

        assertThat(acc.end()).isEqualTo(100_000);
        assertThat(acc.buffer()[acc.indexOf(99_999)]).isEqualTo((short) 7);
    }

    @Test
    void clearRestartsAtZero() {
        SampleAccumulator acc = new SampleAccumulator();
        acc.append(new short[]{1, 2, 3}, 1, 2);
        acc.discardBefore(1);

        acc.clear();

        assertThat(acc.start()).isZero();
        assertThat(acc.end()).isZero();
    }
}
