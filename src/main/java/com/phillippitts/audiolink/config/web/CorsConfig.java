package com.phillippitts.audiolink.config.web;

import com.phillippitts.audiolink.config.properties.CorsProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Cross-origin access for the browser client, driven by {@code audiolink.cors.allowed-origins}.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private static final Logger LOG = LogManager.getLogger(CorsConfig.class);

    static final String[] EXPOSED_HEADERS = {
            "Content-Disposition", "X-AudioLink-Profile", "X-AudioLink-Duration-Ms", "X-Request-ID"
    };

    private final CorsProperties corsProperties;

    public CorsConfig(CorsProperties corsProperties) {
        this.corsProperties = corsProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = corsProperties.getAllowedOrigins().stream()
                .map(String::strip)
                .filter(o -> !o.isEmpty())
                .toList();
        if (origins.isEmpty()) {
            origins = List.of("*");
        }

        CorsRegistration registration = registry.addMapping("/**");
        // Credentials cannot be combined with a literal "*" origin, only with a pattern
        registration.allowedOriginPatterns(origins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(EXPOSED_HEADERS)
                .allowCredentials(true);
        LOG.info("CORS enabled for origins: {}", origins);
    }
}
