package com.statlens.tables.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * The API is read-only, so browsers on the configured origins may only GET it.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;
    private final long maxAgeSeconds;

    public CorsConfig(@Value("${statlens.cors.allowed-origins:http://localhost:5173}") String[] allowedOrigins,
                      @Value("${statlens.cors.max-age-seconds:3600}") long maxAgeSeconds) {
        this.allowedOrigins = allowedOrigins;
        this.maxAgeSeconds = maxAgeSeconds;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/v1/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET")
                .maxAge(maxAgeSeconds);
    }
}
