package com.phillippitts.audiolink.config.modem;

import com.phillippitts.audiolink.config.properties.ModemProperties;
import com.phillippitts.audiolink.service.modem.ModemPool;
import com.phillippitts.audiolink.service.modem.fsk.MultiToneFskModem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the process-wide {@link ModemPool}, filled with {@link MultiToneFskModem} instances.
 */
@Configuration
public class ModemConfig {

    @Bean(destroyMethod = "close")
    public ModemPool modemPool(ModemProperties properties) {
        int volume = properties.getVolume();
        return new ModemPool(properties.getPoolSize(), properties.getAcquireTimeoutMs(),
                () -> new MultiToneFskModem(volume));
    }
}
