package com.pipestudio.pipestudio_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.time.Duration;
import java.util.List;

/**
 * CORS for the IDE: the REST API and the STOMP handshake share one origin list.
 */
@Configuration
public class CorsConfig {

    // Comma-separated patterns, e.g. "http://localhost:*,https://*.pipestudio.dev"
    @Value("#{'${app.cors.allowed-origins:http://localhost:3000}'.split('\\s*,\\s*')}")
    private List<String> allowedOrigins;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration editor = new CorsConfiguration();
        editor.setAllowedOriginPatterns(allowedOrigins);
        editor.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        editor.setAllowedHeaders(List.of("*"));
        editor.setAllowCredentials(true);
        editor.setMaxAge(Duration.ofHours(1));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", editor);
        source.registerCorsConfiguration("/ws/**", editor);
        return new CorsFilter(source);
    }
}
