package com.phillippitts.audiolink.service.health;

import com.phillippitts.audiolink.service.modem.ModemPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the modem pool.
 *
 * <ul>
 *   <li>UP: pool open with at least one idle instance</li>
 *   <li>BUSY: pool open, every instance borrowed</li>
 *   <li>DOWN: pool closed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class ModemHealthIndicator implements HealthIndicator {

    static final String BUSY = "BUSY";

    private final ModemPool pool;

    public ModemHealthIndicator(ModemPool pool) {
        this.pool = pool;
    }

    @Override
    public Health health() {
        Health.Builder builder;
        if (pool.isClosed()) {
            builder = Health.down().withDetail("status", "Modem pool closed");
        } else if (pool.available() == 0) {
            builder = Health.status(BUSY).withDetail("status", "All modem instances in use");
        } else {
            builder = Health.up().withDetail("status", "Modem pool operational");
        }
        return builder
                .withDetail("poolSize", pool.size())
                .withDetail("available", pool.available())
                .withDetail("replacements", pool.replacements())
                .build();
    }
}
