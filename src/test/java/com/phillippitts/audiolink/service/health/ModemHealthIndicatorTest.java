package com.phillippitts.audiolink.service.health;

import com.phillippitts.audiolink.service.modem.ModemPool;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModemHealthIndicatorTest {

    @Test
    void shouldReportUpWhenInstancesIdle() {
        ModemPool pool = mock(ModemPool.class);
        when(pool.size()).thenReturn(4);
        when(pool.available()).thenReturn(3);
        when(pool.replacements()).thenReturn(1L);

        Health health = new ModemHealthIndicator(pool).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("poolSize", 4)
                .containsEntry("available", 3)
                .containsEntry("replacements", 1L);
    }

    @Test
    void shouldReportBusyWhenEveryInstanceBorrowed() {
        ModemPool pool = mock(ModemPool.class);
        when(pool.size()).thenReturn(2);
        when(pool.available()).thenReturn(0);

        Health health = new ModemHealthIndicator(pool).health();

        assertThat(health.getStatus().getCode()).isEqualTo("BUSY");
        assertThat(health.getDetails()).containsEntry("status", "All modem instances in use");
    }

    @Test
    void shouldReportDownWhenPoolClosed() {
        ModemPool pool = mock(ModemPool.class);
        when(pool.isClosed()).thenReturn(true);

        Health health = new ModemHealthIndicator(pool).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
