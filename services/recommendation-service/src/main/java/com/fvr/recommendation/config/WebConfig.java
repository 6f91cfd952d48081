package com.fvr.recommendation.config;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.cors.allowed-methods:GET,POST,OPTIONS}")
    private String allowedMethods;

    @Value("${app.cors.allowed-headers:content-type}")
    private String allowedHeaders;

    @Value("${app.cors.max-age-seconds:600}")
    private long maxAgeSeconds;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOrigins("*")
            .allowedMethods(split(allowedMethods))
            .allowedHeaders(split(allowedHeaders))
            .exposedHeaders("x-request-id", "x-trace-id")
            .allowCredentials(false)
            .maxAge(maxAgeSeconds);
    }

    private static String[] split(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toArray(String[]::new);
    }
}
