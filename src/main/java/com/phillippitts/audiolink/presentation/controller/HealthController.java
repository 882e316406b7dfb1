package com.phillippitts.audiolink.presentation.controller;

import com.phillippitts.audiolink.service.modem.ModemPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight liveness endpoint for the browser client. Detailed health lives under
 * /actuator/health.
 */
@RestController
class HealthController {

    private static final Logger log = LogManager.getLogger(HealthController.class);

    private final ModemPool modemPool;

    HealthController(ModemPool modemPool) {
        this.modemPool = modemPool;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", !modemPool.isClosed());
        body.put("modemsAvailable", modemPool.available());
        body.put("modemPoolSize", modemPool.size());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
