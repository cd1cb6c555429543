package com.taskboard.servicebackend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app.cors")
public class CorsProperties {

    /**
     * Browser origins allowed to call the API. Wildcards as accepted by
     * {@link org.springframework.web.cors.CorsConfiguration#setAllowedOriginPatterns(List)}.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:*"));

    /** How long browsers may cache a preflight answer. */
    private Duration maxAge = Duration.ofHours(1);

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }
}
