package com.phillippitts.audiolink.config.web;

import com.phillippitts.audiolink.config.properties.EncodeProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Body size limits per endpoint. {@code /decode} uploads are bounded by the multipart settings
 * and {@code audiolink.upload.max-bytes}.
 */
@Configuration
public class RequestLimitConfig implements WebMvcConfigurer {

    private static final Logger LOG = LogManager.getLogger(RequestLimitConfig.class);

    private final EncodeProperties encodeProperties;

    public RequestLimitConfig(EncodeProperties encodeProperties) {
        this.encodeProperties = encodeProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RequestSizeInterceptor(encodeProperties.getMaxRequestBytes()))
                .addPathPatterns("/encode");
        LOG.info("Encode request body limit: {} bytes", encodeProperties.getMaxRequestBytes());
    }
}
