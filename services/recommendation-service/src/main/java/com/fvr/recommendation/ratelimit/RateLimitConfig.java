package com.fvr.recommendation.ratelimit;

import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    @Bean
    public RateLimiter rateLimiter(RateLimitProperties properties, Clock clock) {
        return new SlidingWindowRateLimiter(
            properties.getMaxRequests(),
            Duration.ofSeconds(properties.getWindowSeconds()),
            clock
        );
    }
}
